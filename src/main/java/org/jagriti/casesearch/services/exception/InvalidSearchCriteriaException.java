package org.jagriti.casesearch.services.exception;

/**
 * Search input rejected before any upstream call is made.
 */
public class InvalidSearchCriteriaException extends RuntimeException {

    public InvalidSearchCriteriaException(final String message) {
        super(message);
    }

    public InvalidSearchCriteriaException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
