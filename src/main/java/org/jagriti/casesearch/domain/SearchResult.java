package org.jagriti.casesearch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SearchResult(
        @JsonProperty("cases") List<CaseRecord> records,
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("search_criteria") CriteriaEcho criteriaEcho
) {

    public static SearchResult of(final List<CaseRecord> records, final CriteriaEcho criteriaEcho) {
        return new SearchResult(List.copyOf(records), records.size(), criteriaEcho);
    }
}
