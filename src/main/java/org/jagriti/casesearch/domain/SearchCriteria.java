package org.jagriti.casesearch.domain;

import static org.jagriti.casesearch.util.TimeUtils.parseIsoDate;

import org.jagriti.casesearch.services.exception.InvalidSearchCriteriaException;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Caller supplied search input. Dates are optional; when both are present the range must not be
 * inverted.
 */
public record SearchCriteria(
        String stateName,
        String commissionName,
        String searchValue,
        LocalDate fromDate,
        LocalDate toDate,
        SearchKind searchKind
) {

    public SearchCriteria {
        Objects.requireNonNull(searchKind, "searchKind");
        if (fromDate != null && toDate != null && toDate.isBefore(fromDate)) {
            throw new InvalidSearchCriteriaException("to_date must be after from_date");
        }
    }

    /**
     * Builds criteria from raw request values, rejecting malformed dates before anything is sent
     * upstream.
     */
    public static SearchCriteria of(final String stateName,
                                    final String commissionName,
                                    final String searchValue,
                                    final String fromDate,
                                    final String toDate,
                                    final SearchKind searchKind) {
        return new SearchCriteria(
                stateName,
                commissionName,
                searchValue,
                parseIsoDate("from_date", fromDate),
                parseIsoDate("to_date", toDate),
                searchKind
        );
    }

    public SearchCriteria withDefaults(final String normalizedState,
                                       final LocalDate defaultFrom,
                                       final LocalDate defaultTo) {
        return new SearchCriteria(
                normalizedState,
                commissionName,
                searchValue,
                fromDate != null ? fromDate : defaultFrom,
                toDate != null ? toDate : defaultTo,
                searchKind
        );
    }
}
