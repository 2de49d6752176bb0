package org.jagriti.casesearch.clients.jagriti;

import lombok.Getter;

/**
 * Non-2xx answer from the portal. Never retried.
 */
@Getter
public class UpstreamHttpException extends JagritiApiException {

    private final int status;
    private final String body;

    public UpstreamHttpException(final int status, final String body) {
        super("HTTP " + status + " error: " + body);
        this.status = status;
        this.body = body;
    }
}
