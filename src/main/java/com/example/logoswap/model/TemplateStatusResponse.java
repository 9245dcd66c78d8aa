package com.example.logoswap.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Templates configured for logo replacement")
public record TemplateStatusResponse(
        @Schema(description = "Whether the replacement endpoint is enabled") boolean enabled,
        @Schema(description = "Configured old logo, null when absent") TemplateInfo oldLogo,
        @Schema(description = "Configured new logo, null when absent") TemplateInfo newLogo) {

    @Schema(description = "Name and native size of a logo template")
    public record TemplateInfo(String name, int width, int height) {
    }
}
