package com.example.logoswap.service;

import java.util.List;

/**
 * Tunable thresholds and geometry for one replacement run.
 *
 * @param acceptanceThreshold  similarity the multi-scale search must exceed
 * @param cornerThreshold      similarity the corner fallback must exceed
 * @param scales               template scales tried by the multi-scale search, in order
 * @param cornerScales         template scales used to size the corner windows, in order
 * @param marginPx             distance of placement slots from the image edges
 * @param inpaintMarginPx      width of the border band sampled around an erased region
 * @param maxLogoWidthFraction cap on the new logo width relative to the image width
 * @param maxLogoWidthPx       absolute cap on the new logo width
 */
public record ReplacementConfig(
        double acceptanceThreshold,
        double cornerThreshold,
        List<Double> scales,
        List<Double> cornerScales,
        int marginPx,
        int inpaintMarginPx,
        double maxLogoWidthFraction,
        int maxLogoWidthPx) {

    public static final double DEFAULT_ACCEPTANCE_THRESHOLD = 0.5;
    public static final double DEFAULT_CORNER_THRESHOLD = 0.6;
    public static final List<Double> DEFAULT_SCALES = List.of(0.4, 0.5, 0.6, 0.75, 1.0, 1.25, 1.5);
    public static final List<Double> DEFAULT_CORNER_SCALES = List.of(1.0, 0.5, 0.75, 1.25);
    public static final int DEFAULT_MARGIN_PX = 20;
    public static final int DEFAULT_INPAINT_MARGIN_PX = 10;
    public static final double DEFAULT_MAX_LOGO_WIDTH_FRACTION = 1.0 / 8.0;
    public static final int DEFAULT_MAX_LOGO_WIDTH_PX = 200;

    public ReplacementConfig {
        requireFinite(acceptanceThreshold, "acceptanceThreshold");
        requireFinite(cornerThreshold, "cornerThreshold");
        scales = requireScales(scales, "scales");
        cornerScales = requireScales(cornerScales, "cornerScales");
        if (marginPx < 0) {
            throw new IllegalArgumentException("marginPx must not be negative");
        }
        if (inpaintMarginPx < 0) {
            throw new IllegalArgumentException("inpaintMarginPx must not be negative");
        }
        if (!(maxLogoWidthFraction > 0.0 && maxLogoWidthFraction <= 1.0)) {
            throw new IllegalArgumentException("maxLogoWidthFraction must be in (0, 1]");
        }
        if (maxLogoWidthPx <= 0) {
            throw new IllegalArgumentException("maxLogoWidthPx must be positive");
        }
    }

    public static ReplacementConfig defaults() {
        return new ReplacementConfig(
                DEFAULT_ACCEPTANCE_THRESHOLD,
                DEFAULT_CORNER_THRESHOLD,
                DEFAULT_SCALES,
                DEFAULT_CORNER_SCALES,
                DEFAULT_MARGIN_PX,
                DEFAULT_INPAINT_MARGIN_PX,
                DEFAULT_MAX_LOGO_WIDTH_FRACTION,
                DEFAULT_MAX_LOGO_WIDTH_PX);
    }

    public ReplacementConfig withAcceptanceThreshold(double threshold) {
        return new ReplacementConfig(threshold, cornerThreshold, scales, cornerScales, marginPx,
                inpaintMarginPx, maxLogoWidthFraction, maxLogoWidthPx);
    }

    public ReplacementConfig withCornerThreshold(double threshold) {
        return new ReplacementConfig(acceptanceThreshold, threshold, scales, cornerScales, marginPx,
                inpaintMarginPx, maxLogoWidthFraction, maxLogoWidthPx);
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be a finite number");
        }
    }

    private static List<Double> requireScales(List<Double> values, String name) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        for (Double value : values) {
            if (value == null || !Double.isFinite(value) || value <= 0.0) {
                throw new IllegalArgumentException(name + " must contain positive numbers only: " + values);
            }
        }
        return List.copyOf(values);
    }
}
