package org.jagriti.casesearch.clients.jagriti;

import org.jagriti.casesearch.clients.jagriti.dto.CaseSearchPayload;
import org.jagriti.casesearch.clients.jagriti.dto.JagritiCaseDetail;
import org.jagriti.casesearch.domain.CommissionEntry;

import java.util.List;

/**
 * Gateway to the Jagriti portal. Each call is one logical round trip, retried only on transport
 * failures; every failure surfaces as a {@link JagritiApiException}.
 */
public interface JagritiClient {

    /**
     * Lists state commissions and circuit benches, unfiltered, in portal order.
     */
    List<CommissionEntry> fetchStateDirectory();

    /**
     * Lists the district commissions of one state, unfiltered, in portal order.
     *
     * @param stateCommissionId the state commission identifier
     */
    List<CommissionEntry> fetchDistrictDirectory(int stateCommissionId);

    /**
     * Runs a case search.
     *
     * @param payload the upstream search body
     * @return raw case rows in portal order
     */
    List<JagritiCaseDetail> executeSearch(CaseSearchPayload payload);
}
