package com.example.logoswap.service;

import com.example.logoswap.model.MatchResult;
import com.example.logoswap.model.Placement;
import com.example.logoswap.model.ReplacementOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Writes replacement events to SLF4J.
 */
public class LoggingReplacementListener implements ReplacementListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingReplacementListener.class);

    @Override
    public void onStateChange(ReplacementState from, ReplacementState to) {
        log.debug("Replacement state {} -> {}", from, to);
    }

    @Override
    public void onSearchCompleted(Optional<MatchResult> bestMatch, boolean accepted) {
        if (bestMatch.isEmpty()) {
            log.info("Template matching produced no candidate at any scale");
            return;
        }
        MatchResult match = bestMatch.get();
        log.info("Best match: similarity {} at scale {}{}", format(match.similarity()), match.scale(),
                accepted ? "" : " (below acceptance threshold)");
    }

    @Override
    public void onCornerFallback(Optional<MatchResult> cornerMatch) {
        if (cornerMatch.isPresent()) {
            log.info("Corner detection found logo at {}", cornerMatch.get().rect());
        } else {
            log.info("Corner detection found no logo");
        }
    }

    @Override
    public void onLogoPlaced(MatchResult occurrence, Placement placement, int logoWidth, int logoHeight) {
        log.info("Removed old logo from ({}, {}) and placed new logo at ({}, {}) with size ({}, {})",
                occurrence.rect().x(), occurrence.rect().y(), placement.x(), placement.y(), logoWidth, logoHeight);
    }

    @Override
    public void onCompleted(ReplacementOutcome outcome) {
        if (!outcome.replaced()) {
            log.info("No old logo found");
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
