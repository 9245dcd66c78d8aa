package com.example.logoswap.image;

import java.util.Arrays;

/**
 * Interleaved 8-bit raster in row-major order. Channel order is gray (1), RGB (3) or RGBA (4).
 * Components that edit pixels work on a {@link #copy()} so that the caller's buffer is left as is.
 */
public final class RasterBuffer {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] pixels;

    private RasterBuffer(int width, int height, int channels, byte[] pixels) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.pixels = pixels;
    }

    /**
     * Creates a raster from a copy of {@code pixels}.
     *
     * @throws IllegalArgumentException when the dimensions, channel count or array length are invalid
     */
    public static RasterBuffer of(int width, int height, int channels, byte[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (pixels == null || pixels.length != width * height * channels) {
            throw new IllegalArgumentException("Pixel array length does not match " + width + "x" + height + "x" + channels);
        }
        return owned(width, height, channels, pixels.clone());
    }

    public static RasterBuffer blank(int width, int height, int channels) {
        return of(width, height, channels, new byte[width * height * channels]);
    }

    public static RasterBuffer filled(int width, int height, int... color) {
        RasterBuffer buffer = blank(width, height, color.length);
        buffer.fill(0, 0, width, height, color);
        return buffer;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channels;
    }

    public boolean hasAlpha() {
        return channels == 4;
    }

    /**
     * @return a copy of the interleaved pixel data
     */
    public byte[] pixels() {
        return pixels.clone();
    }

    public int sample(int x, int y, int channel) {
        return pixels[offset(x, y) + channel] & 0xFF;
    }

    public void setSample(int x, int y, int channel, int value) {
        pixels[offset(x, y) + channel] = (byte) clamp(value);
    }

    public int[] pixel(int x, int y) {
        int[] values = new int[channels];
        int base = offset(x, y);
        for (int c = 0; c < channels; c++) {
            values[c] = pixels[base + c] & 0xFF;
        }
        return values;
    }

    /**
     * Fills the given rectangle, clipped to the raster bounds, with a single color.
     */
    public void fill(int x, int y, int w, int h, int... color) {
        if (color.length != channels) {
            throw new IllegalArgumentException("Fill color has " + color.length + " channels, raster has " + channels);
        }
        int left = Math.max(0, x);
        int top = Math.max(0, y);
        int right = Math.min(width, x + w);
        int bottom = Math.min(height, y + h);
        for (int row = top; row < bottom; row++) {
            for (int col = left; col < right; col++) {
                int base = offset(col, row);
                for (int c = 0; c < channels; c++) {
                    pixels[base + c] = (byte) clamp(color[c]);
                }
            }
        }
    }

    /**
     * Copies the given window, which must lie inside the raster, into a new buffer.
     */
    public RasterBuffer crop(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > width || y + h > height) {
            throw new IllegalArgumentException("Crop window (" + x + ", " + y + ", " + w + ", " + h
                    + ") is outside a " + width + "x" + height + " raster");
        }
        byte[] data = new byte[w * h * channels];
        int rowLength = w * channels;
        for (int row = 0; row < h; row++) {
            System.arraycopy(pixels, offset(x, y + row), data, row * rowLength, rowLength);
        }
        return owned(w, h, channels, data);
    }

    public RasterBuffer copy() {
        return owned(width, height, channels, pixels.clone());
    }

    byte[] rawPixels() {
        return pixels;
    }

    static RasterBuffer wrap(int width, int height, int channels, byte[] pixels) {
        return owned(width, height, channels, pixels);
    }

    private static RasterBuffer owned(int width, int height, int channels, byte[] pixels) {
        return new RasterBuffer(width, height, channels, pixels);
    }

    private int offset(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return (y * width + x) * channels;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RasterBuffer)) {
            return false;
        }
        RasterBuffer that = (RasterBuffer) other;
        return width == that.width && height == that.height && channels == that.channels
                && Arrays.equals(pixels, that.pixels);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        result = 31 * result + channels;
        return 31 * result + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "RasterBuffer[" + width + "x" + height + "x" + channels + "]";
    }
}
