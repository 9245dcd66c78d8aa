package com.example.logoswap.config;

import com.example.logoswap.service.LoggingReplacementListener;
import com.example.logoswap.service.ReplacementListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the default {@link ReplacementListener}, which logs pipeline events. Projects that want
 * metrics or tracing can replace this bean with their own configuration.
 */
@Configuration
public class ReplacementConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReplacementConfiguration.class);

    @Bean
    public ReplacementListener replacementListener() {
        log.info("Using logging replacement listener");
        return new LoggingReplacementListener();
    }
}
