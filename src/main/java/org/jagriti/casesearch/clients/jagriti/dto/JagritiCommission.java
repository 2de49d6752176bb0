package org.jagriti.casesearch.clients.jagriti.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the state or district commission directory, as sent by the portal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JagritiCommission(
        @JsonProperty("commissionId") Integer commissionId,
        @JsonProperty("commissionNameEn") String commissionNameEn,
        @JsonProperty("circuitAdditionBenchStatus") Boolean circuitAdditionBenchStatus,
        @JsonProperty("activeStatus") Boolean activeStatus
) {
}
