package org.jagriti.casesearch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DistrictListing(
        @JsonProperty("commissions") List<DistrictCommission> commissions,
        @JsonProperty("state_id") int stateId,
        @JsonProperty("state_name") String stateName,
        @JsonProperty("total_count") int totalCount
) {

    public static DistrictListing of(final int stateId,
                                     final String stateName,
                                     final List<DistrictCommission> commissions) {
        return new DistrictListing(List.copyOf(commissions), stateId, stateName, commissions.size());
    }
}
