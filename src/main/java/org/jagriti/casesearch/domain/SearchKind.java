package org.jagriti.casesearch.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Query dimensions understood by the portal case search. The code is the {@code serchType}
 * discriminant sent upstream.
 */
public enum SearchKind {
    CASE_NUMBER(1, "by-case-number", "Case Number"),
    COMPLAINANT(2, "by-complainant", "Complainant"),
    RESPONDENT(3, "by-respondent", "Respondent"),
    COMPLAINANT_ADVOCATE(4, "by-complainant-advocate", "Complainant Advocate"),
    RESPONDENT_ADVOCATE(5, "by-respondent-advocate", "Respondent Advocate"),
    INDUSTRY_TYPE(6, "by-industry-type", "Industry Type"),
    JUDGE(7, "by-judge", "Judge");

    private final int code;
    private final String slug;
    private final String label;

    SearchKind(final int code, final String slug, final String label) {
        this.code = code;
        this.slug = slug;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String slug() {
        return slug;
    }

    public String label() {
        return label;
    }

    public static Optional<SearchKind> fromSlug(final String slug) {
        return Arrays.stream(values())
                .filter(kind -> kind.slug.equals(slug))
                .findFirst();
    }
}
