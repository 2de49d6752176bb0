package org.jagriti.casesearch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StateCommission(
        @JsonProperty("commission_id") int commissionId,
        @JsonProperty("name") String name,
        @JsonProperty("active") boolean active,
        @JsonProperty("is_circuit_bench") boolean circuitBench
) {

    public static StateCommission from(final CommissionEntry entry) {
        return new StateCommission(entry.id(), entry.displayName(), entry.active(), entry.circuitBench());
    }
}
