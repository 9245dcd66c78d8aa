package com.example.logoswap.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Location of an old logo occurrence that was erased")
public record OccurrenceResponse(
        @Schema(description = "X coordinate of the top-left corner", example = "412") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "20") int y,
        @Schema(description = "Width in pixels", example = "120") int width,
        @Schema(description = "Height in pixels", example = "48") int height,
        @Schema(description = "Template scale that produced the match", example = "0.75") double scale,
        @Schema(description = "Normalized cross-correlation score", example = "0.93") double similarity) {

    public static OccurrenceResponse from(MatchResult match) {
        Rect rect = match.rect();
        return new OccurrenceResponse(rect.x(), rect.y(), rect.width(), rect.height(), match.scale(), match.similarity());
    }
}
