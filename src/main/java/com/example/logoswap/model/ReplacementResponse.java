package com.example.logoswap.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Logo replacement output for a single uploaded image")
public record ReplacementResponse(
        @Schema(description = "Original name of the processed file", example = "banner.png") String fileName,
        @Schema(description = "Whether the old logo was found and replaced") boolean replaced,
        @Schema(description = "Old logo occurrences that were erased") List<OccurrenceResponse> occurrences,
        @Schema(description = "Encoding of the returned image", example = "png") String format,
        @Schema(description = "Base64 encoded result image") String image) {
}
