package org.jagriti.casesearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Bind from: jagriti.api.*
 */
@ConfigurationProperties(prefix = "jagriti.api")
public record ApiInfoProperties(
        String title,
        String version,
        String description,
        List<String> allowedOrigins
) {
    public ApiInfoProperties {
        if (title == null || title.isBlank()) title = "Jagriti Consumer Court API";
        if (version == null || version.isBlank()) version = "1.0.0";
        if (description == null) description = "Search District Consumer Court cases from the Jagriti portal";
        if (allowedOrigins == null || allowedOrigins.isEmpty()) allowedOrigins = List.of("*");
    }
}
