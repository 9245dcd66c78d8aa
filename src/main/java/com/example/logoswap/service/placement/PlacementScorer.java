package com.example.logoswap.service.placement;

import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.image.RasterOps;
import com.example.logoswap.image.RasterOps.LuminanceStats;
import com.example.logoswap.model.Anchor;
import com.example.logoswap.model.Placement;
import com.example.logoswap.model.PlacementCandidate;
import com.example.logoswap.model.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks a site for the new logo among six fixed slots. A slot scores well when its background
 * is mid-tone and flat; bottom slots get a bonus.
 */
@Component
public class PlacementScorer {

    private static final Logger log = LoggerFactory.getLogger(PlacementScorer.class);

    public static final int DEFAULT_MARGIN_PX = 20;

    static final double INTENSITY_WEIGHT = 0.4;
    static final double CONSISTENCY_WEIGHT = 0.4;
    static final double BOTTOM_BONUS = 0.3;
    static final double STD_DEV_SCALE = 50.0;

    public Placement findSite(RasterBuffer image, int logoWidth, int logoHeight, List<Rect> avoid) {
        return findSite(image, logoWidth, logoHeight, avoid, DEFAULT_MARGIN_PX);
    }

    /**
     * Always returns a position. When every slot is out of bounds or overlaps {@code avoid} the
     * bottom-left position {@code (margin, height - logoHeight - margin)} is returned unchecked,
     * so it may itself lie partly or fully outside a very small image.
     */
    public Placement findSite(RasterBuffer image, int logoWidth, int logoHeight, List<Rect> avoid, int marginPx) {
        Objects.requireNonNull(image, "image");
        List<Rect> regionsToAvoid = avoid == null ? List.of() : avoid;

        PlacementCandidate best = null;
        for (PlacementCandidate candidate : score(image, logoWidth, logoHeight, regionsToAvoid, marginPx)) {
            if (best == null || candidate.score() > best.score()) {
                best = candidate;
            }
        }

        if (best != null) {
            log.info("Selected position: {} at ({}, {}) with score {}", best.anchor(),
                    best.rect().x(), best.rect().y(), String.format("%.3f", best.score()));
            return new Placement(best.rect().x(), best.rect().y(), best.anchor(), best.score());
        }

        int fallbackX = marginPx;
        int fallbackY = image.height() - logoHeight - marginPx;
        log.info("Using fallback position: bottom-left at ({}, {})", fallbackX, fallbackY);
        return Placement.fallback(fallbackX, fallbackY);
    }

    /**
     * Scores every slot that lies inside the image and does not overlap {@code avoid}, in anchor
     * priority order.
     */
    public List<PlacementCandidate> score(RasterBuffer image, int logoWidth, int logoHeight,
                                          List<Rect> avoid, int marginPx) {
        if (logoWidth <= 0 || logoHeight <= 0) {
            throw new IllegalArgumentException("Logo size must be positive: " + logoWidth + "x" + logoHeight);
        }
        List<PlacementCandidate> candidates = new ArrayList<>();
        for (Anchor anchor : Anchor.values()) {
            Rect slot = slot(anchor, image.width(), image.height(), logoWidth, logoHeight, marginPx);
            if (!slot.isInside(image.width(), image.height())) {
                continue;
            }
            if (avoid.stream().anyMatch(slot::intersects)) {
                log.debug("Position {} overlaps a region to avoid", anchor);
                continue;
            }
            LuminanceStats stats = RasterOps.luminance(image, slot.x(), slot.y(), slot.width(), slot.height());
            double intensityScore = 1.0 - Math.abs(stats.mean() - 128.0) / 128.0;
            double consistencyScore = 1.0 - Math.min(stats.stdDev() / STD_DEV_SCALE, 1.0);
            double positionBonus = anchor.isBottom() ? BOTTOM_BONUS : 0.0;
            double total = INTENSITY_WEIGHT * intensityScore + CONSISTENCY_WEIGHT * consistencyScore + positionBonus;
            log.debug("Position {} at ({}, {}): score {}", anchor, slot.x(), slot.y(), String.format("%.3f", total));
            candidates.add(new PlacementCandidate(anchor, slot, total));
        }
        return candidates;
    }

    static Rect slot(Anchor anchor, int imageWidth, int imageHeight, int logoWidth, int logoHeight, int margin) {
        int left = margin;
        int right = imageWidth - logoWidth - margin;
        int center = Math.floorDiv(imageWidth - logoWidth, 2);
        int top = margin;
        int bottom = imageHeight - logoHeight - margin;
        return switch (anchor) {
            case BOTTOM_LEFT -> new Rect(left, bottom, logoWidth, logoHeight);
            case BOTTOM_RIGHT -> new Rect(right, bottom, logoWidth, logoHeight);
            case TOP_LEFT -> new Rect(left, top, logoWidth, logoHeight);
            case TOP_RIGHT -> new Rect(right, top, logoWidth, logoHeight);
            case BOTTOM_CENTER -> new Rect(center, bottom, logoWidth, logoHeight);
            case TOP_CENTER -> new Rect(center, top, logoWidth, logoHeight);
        };
    }
}
