package org.jagriti.casesearch.services;

import org.jagriti.casesearch.clients.jagriti.JagritiApiException;
import org.jagriti.casesearch.clients.jagriti.JagritiClient;
import org.jagriti.casesearch.clients.jagriti.dto.CaseSearchPayload;
import org.jagriti.casesearch.clients.jagriti.dto.JagritiCaseDetail;
import org.jagriti.casesearch.domain.CaseRecord;
import org.jagriti.casesearch.domain.CriteriaEcho;
import org.jagriti.casesearch.domain.ResolvedQuery;
import org.jagriti.casesearch.domain.SearchCriteria;
import org.jagriti.casesearch.domain.SearchResult;
import org.jagriti.casesearch.services.exception.CaseSearchException;
import org.jagriti.casesearch.services.exception.CommissionNotFoundException;
import org.jagriti.casesearch.services.mapper.CaseRecordMapper;

import java.util.List;
import java.util.Locale;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a case search end to end: normalise, resolve state, resolve district, build the portal
 * payload, search, reshape. Any failing step aborts the whole search.
 */
@Slf4j
@Service
public class CaseSearchService {

    private final DirectoryResolver directoryResolver;
    private final JagritiClient jagritiClient;
    private final CaseRecordMapper caseRecordMapper;
    private final CaseSearchProperties properties;

    public CaseSearchService(final DirectoryResolver directoryResolver,
                             final JagritiClient jagritiClient,
                             final CaseRecordMapper caseRecordMapper,
                             final CaseSearchProperties properties) {
        this.directoryResolver = directoryResolver;
        this.jagritiClient = jagritiClient;
        this.caseRecordMapper = caseRecordMapper;
        this.properties = properties;
    }

    public SearchResult search(final SearchCriteria criteria) {
        final SearchCriteria normalized = normalize(criteria);
        try {
            final int stateId = directoryResolver.resolveState(normalized.stateName())
                    .orElseThrow(() -> CommissionNotFoundException.state(normalized.stateName()));

            final int districtId = directoryResolver.resolveDistrict(stateId, normalized.commissionName())
                    .orElseThrow(() -> CommissionNotFoundException.commission(
                            normalized.commissionName(), normalized.stateName()));

            final ResolvedQuery query = new ResolvedQuery(
                    stateId,
                    districtId,
                    normalized.searchKind(),
                    normalized.searchValue(),
                    normalized.fromDate(),
                    normalized.toDate()
            );

            final List<JagritiCaseDetail> rows = jagritiClient.executeSearch(buildPayload(query));
            final List<CaseRecord> records = rows.stream()
                    .map(caseRecordMapper::toCaseRecord)
                    .toList();

            log.info("Found {} cases for {} search", records.size(), query.searchKind().label());
            return SearchResult.of(records, CriteriaEcho.of(normalized, query));
        } catch (CommissionNotFoundException | JagritiApiException e) {
            log.warn("Case search by {} failed: {}", normalized.searchKind().label(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error in case search by {}", normalized.searchKind().label(), e);
            throw new CaseSearchException("Case search failed: " + e.getMessage(), e);
        }
    }

    SearchCriteria normalize(final SearchCriteria criteria) {
        final String state = criteria.stateName() == null ? null : criteria.stateName().toUpperCase(Locale.ROOT);
        return criteria.withDefaults(state, properties.defaultFromDate(), properties.defaultToDate());
    }

    CaseSearchPayload buildPayload(final ResolvedQuery query) {
        return new CaseSearchPayload(
                query.districtCommissionId(),
                CaseSearchPayload.DATE_REQUEST_TYPE_FILING_DATE,
                query.fromDate().toString(),
                query.toDate().toString(),
                CaseSearchPayload.ALL_JUDGES,
                CaseSearchPayload.ORDER_TYPE_DAILY_ORDERS,
                query.searchKind().code(),
                query.searchValue()
        );
    }
}
