package org.jagriti.casesearch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DistrictCommission(
        @JsonProperty("commission_id") int commissionId,
        @JsonProperty("name") String name,
        @JsonProperty("active") boolean active
) {

    public static DistrictCommission from(final CommissionEntry entry) {
        return new DistrictCommission(entry.id(), entry.displayName(), entry.active());
    }
}
