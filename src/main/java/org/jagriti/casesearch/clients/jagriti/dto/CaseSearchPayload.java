package org.jagriti.casesearch.clients.jagriti.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the portal case search call. Field names, including the upstream spelling of
 * {@code serchType}, are part of the wire contract.
 */
public record CaseSearchPayload(
        @JsonProperty("commissionId") int commissionId,
        @JsonProperty("dateRequestType") int dateRequestType,
        @JsonProperty("fromDate") String fromDate,
        @JsonProperty("toDate") String toDate,
        @JsonProperty("judgeId") String judgeId,
        @JsonProperty("orderType") int orderType,
        @JsonProperty("serchType") int serchType,
        @JsonProperty("serchTypeValue") String serchTypeValue
) {

    /** Filter on case filing date. */
    public static final int DATE_REQUEST_TYPE_FILING_DATE = 1;

    /** Daily orders only. */
    public static final int ORDER_TYPE_DAILY_ORDERS = 1;

    /** Judge names are searched through {@code serchTypeValue}, never through this filter. */
    public static final String ALL_JUDGES = "";
}
