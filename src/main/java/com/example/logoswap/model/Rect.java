package com.example.logoswap.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned rectangle in image pixel coordinates with the origin in the top-left corner.
 * The position may lie outside the image; the size is always positive.
 */
@Schema(description = "Axis-aligned rectangle in image pixel coordinates")
public record Rect(
        @Schema(description = "X coordinate of the top-left corner", example = "42") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "128") int y,
        @Schema(description = "Width in pixels", example = "180") int width,
        @Schema(description = "Height in pixels", example = "60") int height) {

    public Rect {
        if (width <= 0) {
            throw new IllegalArgumentException("Rect width must be positive");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("Rect height must be positive");
        }
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    public long area() {
        return (long) width * height;
    }

    public long overlapArea(Rect other) {
        long overlapX = Math.max(0, Math.min(right(), other.right()) - Math.max(x, other.x));
        long overlapY = Math.max(0, Math.min(bottom(), other.bottom()) - Math.max(y, other.y));
        return overlapX * overlapY;
    }

    /**
     * @return {@code true} when the two rectangles share a region of non-zero area
     */
    public boolean intersects(Rect other) {
        return overlapArea(other) > 0;
    }

    public boolean isInside(int imageWidth, int imageHeight) {
        return x >= 0 && y >= 0 && right() <= imageWidth && bottom() <= imageHeight;
    }
}
