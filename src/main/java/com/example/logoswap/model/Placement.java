package com.example.logoswap.model;

/**
 * Chosen top-left position for the new logo. {@code anchor} is {@code null} and {@code score} is
 * {@link Double#NaN} when no candidate survived and the bottom-left fallback was used.
 */
public record Placement(int x, int y, Anchor anchor, double score) {

    public static Placement fallback(int x, int y) {
        return new Placement(x, y, null, Double.NaN);
    }

    public boolean isFallback() {
        return anchor == null;
    }
}
