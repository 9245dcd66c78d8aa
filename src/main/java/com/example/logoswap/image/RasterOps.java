package com.example.logoswap.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.Objects;

/**
 * Conversions between {@link RasterBuffer} and OpenCV matrices together with the handful of
 * pixel operations the replacement pipeline needs: resampling, luminance statistics and alpha
 * compositing.
 */
public final class RasterOps {

    static {
        OpenCvLoader.ensureLoaded();
    }

    private RasterOps() {
    }

    public static Mat toMat(RasterBuffer buffer) {
        Mat mat = new Mat(buffer.height(), buffer.width(), CvType.CV_8UC(buffer.channels()));
        mat.put(0, 0, buffer.rawPixels());
        return mat;
    }

    public static RasterBuffer fromMat(Mat mat) {
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] data = new byte[(int) (continuous.total() * continuous.channels())];
            continuous.get(0, 0, data);
            return RasterBuffer.wrap(continuous.cols(), continuous.rows(), continuous.channels(), data);
        } finally {
            if (continuous != mat) {
                continuous.release();
            }
        }
    }

    /**
     * Three channel RGB matrix without alpha, the form used for correlation.
     */
    public static Mat toColorMat(RasterBuffer buffer) {
        Mat source = toMat(buffer);
        if (buffer.channels() == 3) {
            return source;
        }
        Mat color = new Mat();
        try {
            int code = buffer.channels() == 4 ? Imgproc.COLOR_RGBA2RGB : Imgproc.COLOR_GRAY2RGB;
            Imgproc.cvtColor(source, color, code);
            return color;
        } finally {
            source.release();
        }
    }

    public static RasterBuffer toRgba(RasterBuffer buffer) {
        if (buffer.channels() == 4) {
            return buffer.copy();
        }
        byte[] source = buffer.rawPixels();
        byte[] rgba = new byte[buffer.width() * buffer.height() * 4];
        int channels = buffer.channels();
        for (int i = 0, j = 0; i < source.length; i += channels, j += 4) {
            if (channels == 1) {
                rgba[j] = source[i];
                rgba[j + 1] = source[i];
                rgba[j + 2] = source[i];
            } else {
                rgba[j] = source[i];
                rgba[j + 1] = source[i + 1];
                rgba[j + 2] = source[i + 2];
            }
            rgba[j + 3] = (byte) 0xFF;
        }
        return RasterBuffer.wrap(buffer.width(), buffer.height(), 4, rgba);
    }

    public static RasterBuffer toRgb(RasterBuffer buffer) {
        if (buffer.channels() == 3) {
            return buffer.copy();
        }
        byte[] source = buffer.rawPixels();
        byte[] rgb = new byte[buffer.width() * buffer.height() * 3];
        int channels = buffer.channels();
        for (int i = 0, j = 0; i < source.length; i += channels, j += 3) {
            rgb[j] = source[i];
            rgb[j + 1] = channels == 1 ? source[i] : source[i + 1];
            rgb[j + 2] = channels == 1 ? source[i] : source[i + 2];
        }
        return RasterBuffer.wrap(buffer.width(), buffer.height(), 3, rgb);
    }

    /**
     * Resamples the raster to the requested size. Area averaging is used when shrinking and
     * Lanczos interpolation when enlarging; an unchanged size returns a plain copy.
     */
    public static RasterBuffer resize(RasterBuffer buffer, int targetWidth, int targetHeight) {
        if (targetWidth <= 0 || targetHeight <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + targetWidth + "x" + targetHeight);
        }
        if (targetWidth == buffer.width() && targetHeight == buffer.height()) {
            return buffer.copy();
        }
        boolean shrinking = targetWidth <= buffer.width() && targetHeight <= buffer.height();
        int interpolation = shrinking ? Imgproc.INTER_AREA : Imgproc.INTER_LANCZOS4;
        Mat source = toMat(buffer);
        Mat resized = new Mat();
        try {
            Imgproc.resize(source, resized, new Size(targetWidth, targetHeight), 0, 0, interpolation);
            return fromMat(resized);
        } finally {
            source.release();
            resized.release();
        }
    }

    /**
     * Mean and population standard deviation of the luminance
     * ({@code 0.299 R + 0.587 G + 0.114 B}) inside a window that lies within the raster.
     */
    public static LuminanceStats luminance(RasterBuffer buffer, int x, int y, int w, int h) {
        Mat window = toMat(buffer.crop(x, y, w, h));
        Mat gray = new Mat();
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stdDev = new MatOfDouble();
        try {
            if (buffer.channels() == 1) {
                window.copyTo(gray);
            } else {
                int code = buffer.channels() == 4 ? Imgproc.COLOR_RGBA2GRAY : Imgproc.COLOR_RGB2GRAY;
                Imgproc.cvtColor(window, gray, code);
            }
            Core.meanStdDev(gray, mean, stdDev);
            return new LuminanceStats(mean.toArray()[0], stdDev.toArray()[0]);
        } finally {
            window.release();
            gray.release();
            mean.release();
            stdDev.release();
        }
    }

    /**
     * Alpha-composites an RGBA overlay onto {@code target} in place with its top-left corner at
     * {@code (x, y)}. Overlay pixels falling outside the target are dropped.
     */
    public static void compositeInto(RasterBuffer target, RasterBuffer overlay, int x, int y) {
        Objects.requireNonNull(target, "target");
        if (overlay.channels() != 4) {
            throw new IllegalArgumentException("Overlay must carry an alpha channel");
        }
        byte[] dst = target.rawPixels();
        byte[] src = overlay.rawPixels();
        int channels = target.channels();
        int left = Math.max(0, x);
        int top = Math.max(0, y);
        int right = Math.min(target.width(), x + overlay.width());
        int bottom = Math.min(target.height(), y + overlay.height());
        for (int row = top; row < bottom; row++) {
            for (int col = left; col < right; col++) {
                int s = ((row - y) * overlay.width() + (col - x)) * 4;
                int d = (row * target.width() + col) * channels;
                int alpha = src[s + 3] & 0xFF;
                if (alpha == 0) {
                    continue;
                }
                if (channels == 1) {
                    int gray = (int) Math.round(0.299 * (src[s] & 0xFF) + 0.587 * (src[s + 1] & 0xFF)
                            + 0.114 * (src[s + 2] & 0xFF));
                    dst[d] = blend(gray, dst[d] & 0xFF, alpha);
                    continue;
                }
                for (int c = 0; c < 3; c++) {
                    dst[d + c] = blend(src[s + c] & 0xFF, dst[d + c] & 0xFF, alpha);
                }
                if (channels == 4) {
                    dst[d + 3] = blend(alpha, dst[d + 3] & 0xFF, alpha);
                }
            }
        }
    }

    private static byte blend(int source, int destination, int alpha) {
        return (byte) Math.round((source * alpha + destination * (255 - alpha)) / 255.0);
    }

    public record LuminanceStats(double mean, double stdDev) {
    }
}
