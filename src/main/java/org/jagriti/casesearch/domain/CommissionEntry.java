package org.jagriti.casesearch.domain;

/**
 * One row of an upstream commission directory, either state level or district level.
 */
public record CommissionEntry(
        int id,
        String displayName,
        boolean active,
        boolean circuitBench
) {
}
