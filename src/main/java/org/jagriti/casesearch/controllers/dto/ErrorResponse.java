package org.jagriti.casesearch.controllers.dto;

import java.time.OffsetDateTime;

public record ErrorResponse(
        String error,
        String message,
        OffsetDateTime timestamp,
        String traceId
) {
}
