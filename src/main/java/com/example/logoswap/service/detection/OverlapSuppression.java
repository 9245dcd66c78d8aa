package com.example.logoswap.service.detection;

import com.example.logoswap.model.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses duplicate detections of the same physical logo, e.g. hits reported by several scales
 * or anchors.
 */
public final class OverlapSuppression {

    public static final double DEFAULT_OVERLAP_THRESHOLD = 0.5;

    private OverlapSuppression() {
    }

    public static List<Rect> dedupe(List<Rect> boxes) {
        return dedupe(boxes, DEFAULT_OVERLAP_THRESHOLD);
    }

    /**
     * Greedy pass in input order: a box is kept unless its overlap with an already kept box
     * exceeds {@code overlapThreshold} of the smaller box's area.
     */
    public static List<Rect> dedupe(List<Rect> boxes, double overlapThreshold) {
        if (boxes == null || boxes.isEmpty()) {
            return List.of();
        }
        List<Rect> kept = new ArrayList<>();
        for (Rect box : boxes) {
            boolean unique = true;
            for (Rect existing : kept) {
                long overlap = box.overlapArea(existing);
                if (overlap > overlapThreshold * Math.min(box.area(), existing.area())) {
                    unique = false;
                    break;
                }
            }
            if (unique) {
                kept.add(box);
            }
        }
        return kept;
    }
}
