package org.jagriti.casesearch.controllers.dto;

import org.jagriti.casesearch.domain.SearchCriteria;
import org.jagriti.casesearch.domain.SearchKind;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * Body shared by every case search endpoint. The meaning of {@code search_value} depends on the
 * endpoint: a case number, a party or advocate name, an industry type or a judge name.
 */
public record CaseSearchRequest(
        @Schema(example = "KARNATAKA")
        @JsonProperty("state") @NotBlank String state,

        @Schema(example = "Bangalore 1st & Rural Additional")
        @JsonProperty("commission") @NotBlank String commission,

        @Schema(example = "REDDY")
        @JsonProperty("search_value") @NotBlank String searchValue,

        @Schema(example = "2025-01-01", description = "Start date in YYYY-MM-DD format")
        @JsonProperty("from_date") String fromDate,

        @Schema(example = "2025-09-03", description = "End date in YYYY-MM-DD format")
        @JsonProperty("to_date") String toDate
) {

    public SearchCriteria toCriteria(final SearchKind kind) {
        return SearchCriteria.of(state, commission, searchValue, fromDate, toDate, kind);
    }
}
