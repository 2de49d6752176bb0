package org.jagriti.casesearch.services.mapper;

import org.jagriti.casesearch.clients.jagriti.JagritiClientProperties;
import org.jagriti.casesearch.clients.jagriti.dto.JagritiCaseDetail;
import org.jagriti.casesearch.domain.CaseRecord;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

@Component
public class CaseRecordMapper {

    private final String portalBaseUrl;

    public CaseRecordMapper(final JagritiClientProperties properties) {
        this.portalBaseUrl = properties.baseUrl();
    }

    public CaseRecord toCaseRecord(final JagritiCaseDetail detail) {
        return new CaseRecord(
                detail.caseNumber(),
                detail.caseStageName(),
                detail.caseFilingDate(),
                detail.complainantName(),
                detail.complainantAdvocateName(),
                detail.respondentName(),
                detail.respondentAdvocateName(),
                documentLink(detail.orderDocumentPath())
        );
    }

    /**
     * Document paths are relative to the portal root.
     */
    String documentLink(final String documentPath) {
        return StringUtils.isEmpty(documentPath) ? null : portalBaseUrl + documentPath;
    }
}
