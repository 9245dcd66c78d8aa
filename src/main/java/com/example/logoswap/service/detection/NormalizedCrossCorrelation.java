package com.example.logoswap.service.detection;

import com.example.logoswap.image.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.imgproc.Imgproc;

import java.util.Optional;

/**
 * Correlation coefficient search shared by the free-form and the corner detectors:
 * {@code sum((I - mean(I)) * (T - mean(T))) / sqrt(sum((I - mean(I))^2) * sum((T - mean(T))^2))}
 * evaluated for every placement of the template inside the image.
 */
final class NormalizedCrossCorrelation {

    static {
        OpenCvLoader.ensureLoaded();
    }

    private NormalizedCrossCorrelation() {
    }

    /**
     * Slides {@code template} over {@code image} (both three channel) and returns the global maximum
     * of the response map. Empty when the template does not fit or has no variance, since the
     * coefficient is undefined for a flat template.
     */
    static Optional<Peak> bestPeak(Mat image, Mat template) {
        if (template.cols() > image.cols() || template.rows() > image.rows()) {
            return Optional.empty();
        }
        if (isFlat(template)) {
            return Optional.empty();
        }
        Mat response = new Mat();
        try {
            Imgproc.matchTemplate(image, template, response, Imgproc.TM_CCOEFF_NORMED);
            Core.MinMaxLocResult extremes = Core.minMaxLoc(response);
            if (Double.isNaN(extremes.maxVal)) {
                return Optional.empty();
            }
            double similarity = Math.max(-1.0, Math.min(1.0, extremes.maxVal));
            return Optional.of(new Peak((int) extremes.maxLoc.x, (int) extremes.maxLoc.y, similarity));
        } finally {
            response.release();
        }
    }

    private static boolean isFlat(Mat template) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stdDev = new MatOfDouble();
        try {
            Core.meanStdDev(template, mean, stdDev);
            for (double deviation : stdDev.toArray()) {
                if (deviation > 1e-6) {
                    return false;
                }
            }
            return true;
        } finally {
            mean.release();
            stdDev.release();
        }
    }

    record Peak(int x, int y, double similarity) {
    }
}
