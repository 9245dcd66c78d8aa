package com.example.logoswap.service.detection;

import com.example.logoswap.image.LogoTemplate;
import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.image.RasterOps;
import com.example.logoswap.model.MatchResult;
import com.example.logoswap.model.Rect;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Searches an image for a logo template at several template scales using normalized
 * cross-correlation and reports the single best hit across all scales. No acceptance threshold
 * is applied; callers decide what similarity counts as a detection.
 */
@Component
public class MultiScaleTemplateMatcher {

    private static final Logger log = LoggerFactory.getLogger(MultiScaleTemplateMatcher.class);

    static final int MIN_TEMPLATE_SIZE = 10;

    public Optional<MatchResult> locate(RasterBuffer image, LogoTemplate template, List<Double> scales) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(scales, "scales");

        Mat imageMat = RasterOps.toColorMat(image);
        try {
            MatchResult best = null;
            for (double scale : scales) {
                int width = (int) Math.round(template.width() * scale);
                int height = (int) Math.round(template.height() * scale);
                if (width < MIN_TEMPLATE_SIZE || height < MIN_TEMPLATE_SIZE
                        || width > image.width() || height > image.height()) {
                    log.debug("Skipping scale {}: template {}x{} does not fit image {}x{}",
                            scale, width, height, image.width(), image.height());
                    continue;
                }
                Optional<NormalizedCrossCorrelation.Peak> peak = correlate(imageMat, template, width, height);
                if (peak.isEmpty()) {
                    log.debug("Skipping scale {}: scaled template has no variance", scale);
                    continue;
                }
                NormalizedCrossCorrelation.Peak hit = peak.get();
                log.debug("Scale {} ({}x{}): similarity {} at ({}, {})",
                        scale, width, height, String.format("%.3f", hit.similarity()), hit.x(), hit.y());
                if (best == null || hit.similarity() > best.similarity()) {
                    best = new MatchResult(new Rect(hit.x(), hit.y(), width, height), scale, hit.similarity());
                }
            }
            if (best != null) {
                log.debug("Best match: similarity {} at scale {}", String.format("%.3f", best.similarity()), best.scale());
            }
            return Optional.ofNullable(best);
        } finally {
            imageMat.release();
        }
    }

    private Optional<NormalizedCrossCorrelation.Peak> correlate(Mat imageMat, LogoTemplate template, int width, int height) {
        Mat templateMat = RasterOps.toColorMat(template.resized(width, height));
        try {
            return NormalizedCrossCorrelation.bestPeak(imageMat, templateMat);
        } finally {
            templateMat.release();
        }
    }
}
