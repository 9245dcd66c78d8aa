package com.example.logoswap.service.detection;

import com.example.logoswap.image.LogoTemplate;
import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.image.RasterOps;
import com.example.logoswap.model.Anchor;
import com.example.logoswap.model.MatchResult;
import com.example.logoswap.model.Rect;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Secondary detector for logos sitting flush in an image corner. Each corner window is compared
 * against the template resized to exactly that window, so only a handful of fixed anchors are
 * scored instead of the whole image.
 */
@Component
public class CornerFallbackDetector {

    private static final Logger log = LoggerFactory.getLogger(CornerFallbackDetector.class);

    private static final List<Anchor> CORNERS =
            List.of(Anchor.BOTTOM_LEFT, Anchor.BOTTOM_RIGHT, Anchor.TOP_LEFT, Anchor.TOP_RIGHT);

    /**
     * Window sizes for the given template scale factors, truncated to whole pixels.
     */
    public static List<WindowSize> sizesFor(LogoTemplate template, List<Double> scales) {
        List<WindowSize> sizes = new ArrayList<>(scales.size());
        for (double scale : scales) {
            sizes.add(new WindowSize((int) (template.width() * scale), (int) (template.height() * scale)));
        }
        return sizes;
    }

    /**
     * @return the best corner window if its similarity is strictly greater than {@code threshold}
     */
    public Optional<MatchResult> scanCorners(RasterBuffer image, LogoTemplate template,
                                             List<WindowSize> sizes, double threshold) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(sizes, "sizes");

        MatchResult best = null;
        Anchor bestCorner = null;
        for (WindowSize size : sizes) {
            if (size.width() <= 0 || size.height() <= 0) {
                continue;
            }
            Mat templateMat = RasterOps.toColorMat(template.resized(size.width(), size.height()));
            try {
                for (Anchor corner : CORNERS) {
                    Rect window = cornerWindow(corner, image.width(), image.height(), size);
                    if (!window.isInside(image.width(), image.height())) {
                        continue;
                    }
                    Optional<NormalizedCrossCorrelation.Peak> peak = score(image, window, templateMat);
                    if (peak.isEmpty()) {
                        continue;
                    }
                    double similarity = peak.get().similarity();
                    log.debug("Checked {} corner (size {}x{}): similarity {}",
                            corner, size.width(), size.height(), String.format("%.3f", similarity));
                    if (best == null || similarity > best.similarity()) {
                        double scale = size.width() / (double) template.width();
                        best = new MatchResult(window, scale, similarity);
                        bestCorner = corner;
                    }
                }
            } finally {
                templateMat.release();
            }
        }

        if (best != null && best.similarity() > threshold) {
            log.info("Found logo in {} corner with similarity {}", bestCorner, String.format("%.3f", best.similarity()));
            return Optional.of(best);
        }
        return Optional.empty();
    }

    private Optional<NormalizedCrossCorrelation.Peak> score(RasterBuffer image, Rect window, Mat templateMat) {
        RasterBuffer region = image.crop(window.x(), window.y(), window.width(), window.height());
        Mat regionMat = RasterOps.toColorMat(region);
        try {
            return NormalizedCrossCorrelation.bestPeak(regionMat, templateMat);
        } finally {
            regionMat.release();
        }
    }

    private static Rect cornerWindow(Anchor corner, int imageWidth, int imageHeight, WindowSize size) {
        int w = size.width();
        int h = size.height();
        return switch (corner) {
            case BOTTOM_LEFT -> new Rect(0, imageHeight - h, w, h);
            case BOTTOM_RIGHT -> new Rect(imageWidth - w, imageHeight - h, w, h);
            case TOP_LEFT -> new Rect(0, 0, w, h);
            case TOP_RIGHT -> new Rect(imageWidth - w, 0, w, h);
            default -> throw new IllegalArgumentException("Not a corner anchor: " + corner);
        };
    }

    public record WindowSize(int width, int height) {
    }
}
