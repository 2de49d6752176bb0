package org.jagriti.casesearch.clients.jagriti.mapper;

import org.jagriti.casesearch.clients.jagriti.MalformedUpstreamResponseException;
import org.jagriti.casesearch.clients.jagriti.dto.JagritiCaseDetail;
import org.jagriti.casesearch.clients.jagriti.dto.JagritiCommission;
import org.jagriti.casesearch.domain.CommissionEntry;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Checks portal rows against the shape callers rely on and converts directory rows into
 * {@link CommissionEntry}. Upstream order is kept.
 */
@Component
public class JagritiDtoMapper {

    public List<CommissionEntry> toCommissionEntries(final List<JagritiCommission> rows) {
        return rows.stream()
                .map(this::toCommissionEntry)
                .toList();
    }

    public CommissionEntry toCommissionEntry(final JagritiCommission row) {
        if (row == null || row.commissionId() == null || StringUtils.isEmpty(row.commissionNameEn())) {
            throw new MalformedUpstreamResponseException("Commission entry without id or name: " + row);
        }
        if (row.activeStatus() == null || row.circuitAdditionBenchStatus() == null) {
            throw new MalformedUpstreamResponseException("Commission entry without status flags: " + row);
        }
        return new CommissionEntry(
                row.commissionId(),
                row.commissionNameEn(),
                row.activeStatus(),
                row.circuitAdditionBenchStatus()
        );
    }

    /**
     * Advocate names and document fields are optional; everything else the search response relies
     * on must be present.
     */
    public List<JagritiCaseDetail> checkCaseDetails(final List<JagritiCaseDetail> rows) {
        for (final JagritiCaseDetail row : rows) {
            if (row == null || row.caseNumber() == null) {
                throw new MalformedUpstreamResponseException("Case entry without case number: " + row);
            }
            final String missing = missingCaseField(row);
            if (missing != null) {
                throw new MalformedUpstreamResponseException(
                        "Case entry " + row.caseNumber() + " without " + missing);
            }
        }
        return rows;
    }

    private static String missingCaseField(final JagritiCaseDetail row) {
        if (row.complainantName() == null) {
            return "complainantName";
        }
        if (row.respondentName() == null) {
            return "respondentName";
        }
        if (row.caseFilingDate() == null) {
            return "caseFilingDate";
        }
        if (row.caseStageName() == null) {
            return "caseStageName";
        }
        if (row.dailyOrderStatus() == null) {
            return "dailyOrderStatus";
        }
        return null;
    }
}
