package org.jagriti.casesearch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StateListing(
        @JsonProperty("states") List<StateCommission> states,
        @JsonProperty("total_count") int totalCount
) {

    public static StateListing of(final List<StateCommission> states) {
        return new StateListing(List.copyOf(states), states.size());
    }
}
