package org.jagriti.casesearch.domain;

import java.time.LocalDate;

public record ResolvedQuery(
        int stateCommissionId,
        int districtCommissionId,
        SearchKind searchKind,
        String searchValue,
        LocalDate fromDate,
        LocalDate toDate
) {
}
