package org.jagriti.casesearch.clients.jagriti.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw case row from the portal search. Document byte payloads are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JagritiCaseDetail(
        @JsonProperty("caseNumber") String caseNumber,
        @JsonProperty("complainantName") String complainantName,
        @JsonProperty("complainantAdvocateName") String complainantAdvocateName,
        @JsonProperty("respondentName") String respondentName,
        @JsonProperty("respondentAdvocateName") String respondentAdvocateName,
        @JsonProperty("caseFilingDate") String caseFilingDate,
        @JsonProperty("orderDocumentPath") String orderDocumentPath,
        @JsonProperty("orderDate") String orderDate,
        @JsonProperty("dateOfDisposal") String dateOfDisposal,
        @JsonProperty("caseStageName") String caseStageName,
        @JsonProperty("dailyOrderStatus") Boolean dailyOrderStatus
) {
}
