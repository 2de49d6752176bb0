package org.jagriti.casesearch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CaseRecord(
        @JsonProperty("case_number") String caseNumber,
        @JsonProperty("case_stage") String caseStage,
        @JsonProperty("filing_date") String filingDate,
        @JsonProperty("complainant") String complainant,
        @JsonProperty("complainant_advocate") String complainantAdvocate,
        @JsonProperty("respondent") String respondent,
        @JsonProperty("respondent_advocate") String respondentAdvocate,
        @JsonProperty("document_link") String documentLink
) {
}
