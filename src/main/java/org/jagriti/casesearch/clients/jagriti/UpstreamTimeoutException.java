package org.jagriti.casesearch.clients.jagriti;

import lombok.Getter;

@Getter
public class UpstreamTimeoutException extends JagritiApiException {

    private final int attempts;

    public UpstreamTimeoutException(final String operation, final int attempts, final Throwable cause) {
        super("Request to Jagriti " + operation + " timed out after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }
}
