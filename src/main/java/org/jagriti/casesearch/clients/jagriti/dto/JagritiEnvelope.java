package org.jagriti.casesearch.clients.jagriti.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Common wrapper the portal puts around every list it returns.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JagritiEnvelope<T>(
        @JsonProperty("data") List<T> data,
        @JsonProperty("message") String message,
        @JsonProperty("error") String error,
        @JsonProperty("status") Integer status
) {
}
