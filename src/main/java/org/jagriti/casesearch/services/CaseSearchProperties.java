package org.jagriti.casesearch.services;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;

/**
 * Bind from: jagriti.search.*
 */
@ConfigurationProperties(prefix = "jagriti.search")
public record CaseSearchProperties(
        LocalDate defaultFromDate,
        LocalDate defaultToDate
) {
    public static final LocalDate FALLBACK_FROM_DATE = LocalDate.of(2025, 1, 1);
    public static final LocalDate FALLBACK_TO_DATE = LocalDate.of(2025, 9, 3);

    public CaseSearchProperties {
        if (defaultFromDate == null) defaultFromDate = FALLBACK_FROM_DATE;
        if (defaultToDate == null) defaultToDate = FALLBACK_TO_DATE;
    }
}
