package com.example.logoswap.service;

import com.example.logoswap.image.LogoTemplate;
import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.image.RasterOps;
import com.example.logoswap.model.MatchResult;
import com.example.logoswap.model.Placement;
import com.example.logoswap.model.Rect;
import com.example.logoswap.model.ReplacementOutcome;
import com.example.logoswap.service.detection.CornerFallbackDetector;
import com.example.logoswap.service.detection.MultiScaleTemplateMatcher;
import com.example.logoswap.service.detection.OverlapSuppression;
import com.example.logoswap.service.inpaint.BackgroundInpainter;
import com.example.logoswap.service.placement.PlacementScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the per-image replacement pipeline as a state machine:
 * {@code START -> SEARCHING -> FOUND | NOT_FOUND}, then for every occurrence
 * {@code ERASING -> PLACING -> COMPOSITING}, and finally {@code DONE}.
 * <p>
 * The service holds no per-call state, so one instance can serve concurrent requests. Not finding
 * the old logo is a regular outcome with {@code replaced == false}, not an error.
 */
@Service
public class LogoReplacementService {

    private static final Logger log = LoggerFactory.getLogger(LogoReplacementService.class);

    private final MultiScaleTemplateMatcher matcher;
    private final CornerFallbackDetector cornerDetector;
    private final BackgroundInpainter inpainter;
    private final PlacementScorer placementScorer;
    private final ReplacementListener listener;

    public LogoReplacementService(MultiScaleTemplateMatcher matcher,
                                  CornerFallbackDetector cornerDetector,
                                  BackgroundInpainter inpainter,
                                  PlacementScorer placementScorer,
                                  ReplacementListener listener) {
        this.matcher = matcher;
        this.cornerDetector = cornerDetector;
        this.inpainter = inpainter;
        this.placementScorer = placementScorer;
        this.listener = listener == null ? ReplacementListener.NONE : listener;
    }

    public ReplacementOutcome replaceLogo(RasterBuffer image, LogoTemplate oldLogo, LogoTemplate newLogo,
                                          ReplacementConfig config) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(oldLogo, "oldLogo");
        Objects.requireNonNull(newLogo, "newLogo");
        Objects.requireNonNull(config, "config");

        Run run = new Run(image, oldLogo, newLogo, config);
        ReplacementState state = ReplacementState.START;
        while (state != ReplacementState.DONE && state != ReplacementState.NOT_FOUND) {
            ReplacementState next = advance(run, state);
            listener.onStateChange(state, next);
            state = next;
        }

        ReplacementOutcome outcome = state == ReplacementState.DONE
                ? new ReplacementOutcome(run.working, true, run.occurrences)
                : ReplacementOutcome.notFound(image.copy());
        listener.onCompleted(outcome);
        return outcome;
    }

    private ReplacementState advance(Run run, ReplacementState state) {
        return switch (state) {
            case START -> ReplacementState.SEARCHING;
            case SEARCHING -> search(run);
            case FOUND -> collapseDuplicates(run);
            case ERASING -> erase(run);
            case PLACING -> place(run);
            case COMPOSITING -> composite(run);
            case NOT_FOUND, DONE -> throw new IllegalStateException("No transition out of terminal state " + state);
        };
    }

    private ReplacementState search(Run run) {
        ReplacementConfig config = run.config;
        Optional<MatchResult> best = matcher.locate(run.image, run.oldLogo, config.scales());
        boolean accepted = best.isPresent() && best.get().similarity() > config.acceptanceThreshold();
        listener.onSearchCompleted(best, accepted);
        if (accepted) {
            run.occurrences.add(best.get());
            return ReplacementState.FOUND;
        }

        Optional<MatchResult> corner = cornerDetector.scanCorners(run.image, run.oldLogo,
                CornerFallbackDetector.sizesFor(run.oldLogo, config.cornerScales()), config.cornerThreshold());
        listener.onCornerFallback(corner);
        if (corner.isPresent()) {
            run.occurrences.add(corner.get());
            return ReplacementState.FOUND;
        }
        return ReplacementState.NOT_FOUND;
    }

    private ReplacementState collapseDuplicates(Run run) {
        List<Rect> kept = OverlapSuppression.dedupe(run.occurrences.stream().map(MatchResult::rect).toList());
        List<MatchResult> unique = new ArrayList<>(kept.size());
        int next = 0;
        for (MatchResult occurrence : run.occurrences) {
            // kept is an ordered subsequence of the same Rect instances
            if (next < kept.size() && kept.get(next) == occurrence.rect()) {
                unique.add(occurrence);
                next++;
            }
        }
        if (unique.size() < run.occurrences.size()) {
            log.debug("Collapsed {} occurrences to {}", run.occurrences.size(), unique.size());
        }
        run.occurrences.clear();
        run.occurrences.addAll(unique);
        run.working = run.image;
        run.index = 0;
        return ReplacementState.ERASING;
    }

    private ReplacementState erase(Run run) {
        MatchResult occurrence = run.occurrences.get(run.index);
        run.working = inpainter.erase(run.working, occurrence.rect(), run.config.inpaintMarginPx());
        return ReplacementState.PLACING;
    }

    private ReplacementState place(Run run) {
        ReplacementConfig config = run.config;
        int imageWidth = run.working.width();
        int cappedWidth = (int) Math.floor(imageWidth * config.maxLogoWidthFraction());
        run.logoWidth = Math.max(1, Math.min(config.maxLogoWidthPx(), cappedWidth));
        run.logoHeight = Math.max(1, (int) (run.logoWidth / run.newLogo.aspectRatio()));

        List<Rect> avoid = run.occurrences.stream().map(MatchResult::rect).toList();
        run.placement = placementScorer.findSite(run.working, run.logoWidth, run.logoHeight, avoid, config.marginPx());
        return ReplacementState.COMPOSITING;
    }

    private ReplacementState composite(Run run) {
        RasterBuffer logo = run.newLogo.resized(run.logoWidth, run.logoHeight);
        // working is always a copy produced by the inpainter, never the caller's buffer
        RasterOps.compositeInto(run.working, logo, run.placement.x(), run.placement.y());
        listener.onLogoPlaced(run.occurrences.get(run.index), run.placement, run.logoWidth, run.logoHeight);
        run.index++;
        return run.index < run.occurrences.size() ? ReplacementState.ERASING : ReplacementState.DONE;
    }

    private static final class Run {
        private final RasterBuffer image;
        private final LogoTemplate oldLogo;
        private final LogoTemplate newLogo;
        private final ReplacementConfig config;
        private final List<MatchResult> occurrences = new ArrayList<>();
        private RasterBuffer working;
        private int index;
        private int logoWidth;
        private int logoHeight;
        private Placement placement;

        private Run(RasterBuffer image, LogoTemplate oldLogo, LogoTemplate newLogo, ReplacementConfig config) {
            this.image = image;
            this.oldLogo = oldLogo;
            this.newLogo = newLogo;
            this.config = config;
        }
    }
}
