package com.example.logoswap.model;

import com.example.logoswap.image.RasterBuffer;

import java.util.List;
import java.util.Objects;

/**
 * Result of one replacement run. When {@code replaced} is {@code false} the {@code modified}
 * buffer is an untouched copy of the input and {@code occurrences} is empty.
 */
public record ReplacementOutcome(RasterBuffer modified, boolean replaced, List<MatchResult> occurrences) {

    public ReplacementOutcome {
        Objects.requireNonNull(modified, "modified");
        occurrences = List.copyOf(occurrences);
    }

    public static ReplacementOutcome notFound(RasterBuffer original) {
        return new ReplacementOutcome(original, false, List.of());
    }
}
