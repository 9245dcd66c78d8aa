package com.example.logoswap.controller;

import com.example.logoswap.config.LogoProperties;
import com.example.logoswap.image.LogoTemplate;
import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.image.RasterCodec;
import com.example.logoswap.model.OccurrenceResponse;
import com.example.logoswap.model.ReplacementOutcome;
import com.example.logoswap.model.ReplacementResponse;
import com.example.logoswap.model.TemplateStatusResponse;
import com.example.logoswap.model.TemplateStatusResponse.TemplateInfo;
import com.example.logoswap.service.LogoReplacementService;
import com.example.logoswap.service.LogoTemplateStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.SERVICE_UNAVAILABLE;

@RestController
@RequestMapping("/api/v1/logos")
@Tag(name = "Logo replacement", description = "Find an old logo in an image and replace it with a new one")
public class LogoReplacementController {

    private static final Logger log = LoggerFactory.getLogger(LogoReplacementController.class);

    private static final Set<String> OUTPUT_FORMATS = Set.of("png", "jpeg", "jpg");

    private final LogoProperties properties;
    private final LogoTemplateStore templates;
    private final LogoReplacementService service;

    public LogoReplacementController(LogoProperties properties, LogoTemplateStore templates,
                                     LogoReplacementService service) {
        this.properties = properties;
        this.templates = templates;
        this.service = service;
    }

    @Operation(
            summary = "Replace the old logo in an uploaded image",
            description = "Searches the image for the old logo, erases it, and places the new logo in a free corner. "
                    + "Templates uploaded with the request override the configured ones.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Image processed; check 'replaced' to see whether the old logo was found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = ReplacementResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing or undecodable image", content = @Content),
            @ApiResponse(responseCode = "503", description = "Replacement disabled or templates not configured", content = @Content)
    })
    @PostMapping(value = "/replace", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ReplacementResponse> replace(
            @Parameter(description = "Image to process", required = true)
            @RequestPart("image") MultipartFile image,
            @Parameter(description = "Old logo template; defaults to the configured template")
            @RequestPart(value = "oldLogo", required = false) MultipartFile oldLogo,
            @Parameter(description = "New logo template; defaults to the configured template")
            @RequestPart(value = "newLogo", required = false) MultipartFile newLogo,
            @Parameter(description = "Output encoding, png or jpeg")
            @RequestParam(value = "format", defaultValue = "png") String format) {
        if (!properties.isEnabled()) {
            throw new ResponseStatusException(SERVICE_UNAVAILABLE, "Logo replacement is disabled");
        }
        String outputFormat = format.trim().toLowerCase(Locale.ROOT);
        if (!OUTPUT_FORMATS.contains(outputFormat)) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported output format: " + format);
        }

        String fileName = fileName(image);
        RasterBuffer raster = RasterCodec.decode(readBytes(image, "Image file is required"));
        LogoTemplate oldTemplate = resolveTemplate(oldLogo, templates.oldLogo(), "Old logo");
        LogoTemplate newTemplate = resolveTemplate(newLogo, templates.newLogo(), "New logo");

        ReplacementOutcome outcome = service.replaceLogo(raster, oldTemplate, newTemplate, properties.toReplacementConfig());
        log.info("Processed {}: replaced={}", fileName, outcome.replaced());

        List<OccurrenceResponse> occurrences = outcome.occurrences().stream()
                .map(OccurrenceResponse::from)
                .collect(Collectors.toList());
        String encoded = Base64.getEncoder().encodeToString(RasterCodec.encode(outcome.modified(), outputFormat));
        return ResponseEntity.ok(new ReplacementResponse(fileName, outcome.replaced(), occurrences, outputFormat, encoded));
    }

    @GetMapping("/templates")
    @Operation(summary = "Show the configured logo templates")
    public ResponseEntity<TemplateStatusResponse> templates() {
        return ResponseEntity.ok(new TemplateStatusResponse(
                properties.isEnabled(),
                templates.oldLogo().map(this::toInfo).orElse(null),
                templates.newLogo().map(this::toInfo).orElse(null)));
    }

    private TemplateInfo toInfo(LogoTemplate template) {
        return new TemplateInfo(template.name(), template.width(), template.height());
    }

    private LogoTemplate resolveTemplate(MultipartFile upload, Optional<LogoTemplate> configured, String role) {
        if (upload != null && !upload.isEmpty()) {
            return RasterCodec.loadTemplate(fileName(upload), readBytes(upload, role + " file is empty"));
        }
        return configured.orElseThrow(() ->
                new ResponseStatusException(SERVICE_UNAVAILABLE, role + " template is not configured"));
    }

    private byte[] readBytes(MultipartFile file, String missingMessage) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, missingMessage);
        }
        try {
            return file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded file", ex);
        }
    }

    private String fileName(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? "image" : name;
    }
}
