package org.jagriti.casesearch.services.exception;

public class CaseSearchException extends RuntimeException {

    public CaseSearchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
