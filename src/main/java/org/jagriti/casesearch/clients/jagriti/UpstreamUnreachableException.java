package org.jagriti.casesearch.clients.jagriti;

import lombok.Getter;

@Getter
public class UpstreamUnreachableException extends JagritiApiException {

    private final int attempts;

    public UpstreamUnreachableException(final String operation, final int attempts, final Throwable cause) {
        super("Request to Jagriti " + operation + " failed after " + attempts + " attempts: "
                + cause.getMessage(), cause);
        this.attempts = attempts;
    }
}
