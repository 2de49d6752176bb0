package org.jagriti.casesearch.clients.jagriti;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly-typed properties for the Jagriti portal client.
 * Bind from: jagriti.client.*
 */
@Validated
@ConfigurationProperties(prefix = "jagriti.client")
public record JagritiClientProperties(
        @NotBlank String baseUrl,
        @NotBlank String statesPath,
        @NotBlank String districtsPath,
        @NotBlank String caseSearchPath,
        @Positive int requestTimeoutMs,
        @Positive int maxRetries,
        @Positive long backoffUnitMs,
        boolean debugLogging,
        Map<String, String> headers
) {
    public static final String DEFAULT_BASE_URL = "https://e-jagriti.gov.in";
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/139.0.0.0 Safari/537.36";

    public JagritiClientProperties {
        // Defaults
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = DEFAULT_BASE_URL;
        if (statesPath == null || statesPath.isBlank()) {
            statesPath = "/services/report/report/getStateCommissionAndCircuitBench";
        }
        if (districtsPath == null || districtsPath.isBlank()) {
            districtsPath = "/services/report/report/getDistrictCommissionByCommissionId";
        }
        if (caseSearchPath == null || caseSearchPath.isBlank()) {
            caseSearchPath = "/services/case/caseFilingService/v2/getCaseDetailsBySearchType";
        }
        if (requestTimeoutMs <= 0) requestTimeoutMs = 30_000;
        if (maxRetries <= 0) maxRetries = 3;
        if (backoffUnitMs <= 0) backoffUnitMs = 1_000;

        final Map<String, String> merged = browserHeaders(baseUrl);
        if (headers != null) {
            merged.putAll(headers);
        }
        headers = Collections.unmodifiableMap(merged);
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    /**
     * Header set of a desktop browser on the portal's own origin; the portal rejects requests
     * without it.
     */
    static Map<String, String> browserHeaders(final String baseUrl) {
        final Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        headers.put("Accept-Language", "en-GB,en-US;q=0.9,en;q=0.8");
        headers.put("Content-Type", "application/json");
        headers.put("DNT", "1");
        headers.put("Origin", baseUrl);
        headers.put("Referer", baseUrl + "/");
        headers.put("Sec-Fetch-Dest", "empty");
        headers.put("Sec-Fetch-Mode", "cors");
        headers.put("Sec-Fetch-Site", "same-origin");
        headers.put("User-Agent", DEFAULT_USER_AGENT);
        headers.put("sec-ch-ua", "\"Not;A=Brand\";v=\"99\", \"Google Chrome\";v=\"139\", \"Chromium\";v=\"139\"");
        headers.put("sec-ch-ua-mobile", "?0");
        headers.put("sec-ch-ua-platform", "\"macOS\"");
        return headers;
    }
}
