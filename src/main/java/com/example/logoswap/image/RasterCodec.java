package com.example.logoswap.image;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Bridges container formats (PNG, JPEG, BMP, GIF) and {@link RasterBuffer}s through
 * {@link ImageIO}.
 */
public final class RasterCodec {

    private RasterCodec() {
    }

    /**
     * Decodes an image payload. The result is RGBA when the source carries transparency and RGB
     * otherwise.
     *
     * @throws ImageDecodeException when the payload is empty, malformed or of an unsupported type
     */
    public static RasterBuffer decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageDecodeException("Image payload is empty");
        }
        BufferedImage image;
        try (ByteArrayInputStream input = new ByteArrayInputStream(bytes)) {
            image = ImageIO.read(input);
        } catch (IOException ex) {
            throw new ImageDecodeException("Failed to read image payload", ex);
        }
        if (image == null) {
            throw new ImageDecodeException("Unable to decode image payload");
        }
        return fromBufferedImage(image);
    }

    public static LogoTemplate loadTemplate(String name, byte[] bytes) {
        return LogoTemplate.of(name, decode(bytes));
    }

    public static LogoTemplate loadTemplate(byte[] bytes) {
        return loadTemplate(null, bytes);
    }

    public static RasterBuffer fromBufferedImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (width <= 0 || height <= 0) {
            throw new ImageDecodeException("Image has no pixels: " + width + "x" + height);
        }
        boolean alpha = image.getColorModel().hasAlpha();
        int channels = alpha ? 4 : 3;
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] pixels = new byte[width * height * channels];
        for (int i = 0, j = 0; i < argb.length; i++, j += channels) {
            int value = argb[i];
            pixels[j] = (byte) (value >> 16);
            pixels[j + 1] = (byte) (value >> 8);
            pixels[j + 2] = (byte) value;
            if (alpha) {
                pixels[j + 3] = (byte) (value >>> 24);
            }
        }
        return RasterBuffer.wrap(width, height, channels, pixels);
    }

    public static BufferedImage toBufferedImage(RasterBuffer buffer) {
        int width = buffer.width();
        int height = buffer.height();
        if (buffer.channels() == 1) {
            BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            gray.getRaster().setDataElements(0, 0, width, height, buffer.pixels());
            return gray;
        }
        int type = buffer.hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage image = new BufferedImage(width, height, type);
        byte[] pixels = buffer.rawPixels();
        int channels = buffer.channels();
        int[] argb = new int[width * height];
        for (int i = 0, j = 0; i < argb.length; i++, j += channels) {
            int a = buffer.hasAlpha() ? pixels[j + 3] & 0xFF : 0xFF;
            argb[i] = (a << 24) | ((pixels[j] & 0xFF) << 16) | ((pixels[j + 1] & 0xFF) << 8) | (pixels[j + 2] & 0xFF);
        }
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    /**
     * Encodes a raster as {@code png} or {@code jpeg}. JPEG output drops the alpha channel.
     */
    public static byte[] encode(RasterBuffer buffer, String format) {
        String normalized = format == null ? "png" : format.trim().toLowerCase(Locale.ROOT);
        RasterBuffer source;
        String writerName;
        switch (normalized) {
            case "png" -> {
                source = buffer;
                writerName = "png";
            }
            case "jpg", "jpeg" -> {
                source = buffer.channels() == 1 ? buffer : RasterOps.toRgb(buffer);
                writerName = "jpeg";
            }
            default -> throw new IllegalArgumentException("Unsupported output format: " + format);
        }
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(toBufferedImage(source), writerName, output)) {
                throw new IllegalStateException("No ImageIO writer available for " + writerName);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to encode image as " + writerName, ex);
        }
        return output.toByteArray();
    }
}
