package com.example.logoswap.service;

import com.example.logoswap.model.MatchResult;
import com.example.logoswap.model.Placement;
import com.example.logoswap.model.ReplacementOutcome;

import java.util.Optional;

/**
 * Receives structured events from {@link LogoReplacementService}. All methods have empty
 * defaults so implementations only override what they need. Calls arrive on the thread running
 * the replacement.
 */
public interface ReplacementListener {

    ReplacementListener NONE = new ReplacementListener() {
    };

    default void onStateChange(ReplacementState from, ReplacementState to) {
    }

    /**
     * @param bestMatch best multi-scale hit, whether or not it cleared the acceptance threshold
     */
    default void onSearchCompleted(Optional<MatchResult> bestMatch, boolean accepted) {
    }

    default void onCornerFallback(Optional<MatchResult> cornerMatch) {
    }

    default void onLogoPlaced(MatchResult occurrence, Placement placement, int logoWidth, int logoHeight) {
    }

    default void onCompleted(ReplacementOutcome outcome) {
    }
}
