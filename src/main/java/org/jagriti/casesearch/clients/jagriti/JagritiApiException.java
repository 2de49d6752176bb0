package org.jagriti.casesearch.clients.jagriti;

/**
 * Base type for every classified failure of a call to the Jagriti portal.
 */
public abstract class JagritiApiException extends RuntimeException {

    protected JagritiApiException(final String message) {
        super(message);
    }

    protected JagritiApiException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
