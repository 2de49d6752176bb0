package org.jagriti.casesearch.util;

import static java.time.ZoneOffset.UTC;

import org.jagriti.casesearch.services.exception.InvalidSearchCriteriaException;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import org.apache.commons.lang3.StringUtils;

/**
 * Time helpers shared by the request and error layers.
 */
public final class TimeUtils {

    private TimeUtils() {
        throw new AssertionError("No instances");
    }

    /**
     * @return current time in UTC
     */
    public static OffsetDateTime utcNow() {
        return OffsetDateTime.now(UTC);
    }

    /**
     * Parses an optional {@code YYYY-MM-DD} calendar date.
     *
     * @param field name reported back to the caller when the value is rejected
     * @param value raw value, may be null or blank
     * @return the parsed date, or null when no value was supplied
     * @throws InvalidSearchCriteriaException when the value is not a valid ISO calendar date
     */
    public static LocalDate parseIsoDate(final String field, final String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidSearchCriteriaException(field + " must be in YYYY-MM-DD format", e);
        }
    }
}
