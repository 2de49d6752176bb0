package org.jagriti.casesearch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The criteria a search actually ran with, including the resolved commission identifiers.
 */
public record CriteriaEcho(
        @JsonProperty("state") String state,
        @JsonProperty("commission") String commission,
        @JsonProperty("search_value") String searchValue,
        @JsonProperty("search_type") int searchType,
        @JsonProperty("from_date") String fromDate,
        @JsonProperty("to_date") String toDate,
        @JsonProperty("state_commission_id") int stateCommissionId,
        @JsonProperty("district_commission_id") int districtCommissionId
) {

    public static CriteriaEcho of(final SearchCriteria criteria, final ResolvedQuery query) {
        return new CriteriaEcho(
                criteria.stateName(),
                criteria.commissionName(),
                query.searchValue(),
                query.searchKind().code(),
                query.fromDate().toString(),
                query.toDate().toString(),
                query.stateCommissionId(),
                query.districtCommissionId()
        );
    }
}
