package com.example.logoswap.service;

import com.example.logoswap.config.LogoProperties;
import com.example.logoswap.image.LogoTemplate;
import com.example.logoswap.image.RasterCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Holds the old and new logo templates configured for the application. Both are read once at
 * start-up and shared read-only by every request.
 */
@Component
public class LogoTemplateStore {

    private static final Logger log = LoggerFactory.getLogger(LogoTemplateStore.class);

    private final LogoTemplate oldLogo;
    private final LogoTemplate newLogo;

    public LogoTemplateStore(LogoProperties properties) {
        this.oldLogo = load("old logo", properties.getOldLogoPath());
        this.newLogo = load("new logo", properties.getNewLogoPath());
    }

    public Optional<LogoTemplate> oldLogo() {
        return Optional.ofNullable(oldLogo);
    }

    public Optional<LogoTemplate> newLogo() {
        return Optional.ofNullable(newLogo);
    }

    private static LogoTemplate load(String role, String location) {
        if (location == null || location.isBlank()) {
            log.info("No {} template configured", role);
            return null;
        }
        Path path = Path.of(location).normalize();
        if (!Files.isRegularFile(path)) {
            log.warn("{} template {} not found. Requests must supply the template explicitly.", role, path.toAbsolutePath());
            return null;
        }
        try {
            LogoTemplate template = RasterCodec.loadTemplate(path.getFileName().toString(), Files.readAllBytes(path));
            log.info("{} loaded: {} (Size: {}x{})", role, path, template.width(), template.height());
            return template;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + role + " template " + path, ex);
        }
    }
}
