package com.example.logoswap.model;

/**
 * Named reference positions for logo placement, declared in placement priority order.
 */
public enum Anchor {
    BOTTOM_LEFT,
    BOTTOM_RIGHT,
    TOP_LEFT,
    TOP_RIGHT,
    BOTTOM_CENTER,
    TOP_CENTER;

    public boolean isBottom() {
        return this == BOTTOM_LEFT || this == BOTTOM_RIGHT || this == BOTTOM_CENTER;
    }
}
