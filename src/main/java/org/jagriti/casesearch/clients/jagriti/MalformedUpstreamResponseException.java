package org.jagriti.casesearch.clients.jagriti;

public class MalformedUpstreamResponseException extends JagritiApiException {

    public MalformedUpstreamResponseException(final String message) {
        super(message);
    }

    public MalformedUpstreamResponseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
