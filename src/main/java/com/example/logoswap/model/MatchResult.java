package com.example.logoswap.model;

import java.util.Objects;

/**
 * Best correlation hit for a template: where it is, at which template scale it was found and how
 * similar the window is, in the correlation coefficient range {@code [-1, 1]}.
 */
public record MatchResult(Rect rect, double scale, double similarity) {

    public MatchResult {
        Objects.requireNonNull(rect, "rect");
    }
}
