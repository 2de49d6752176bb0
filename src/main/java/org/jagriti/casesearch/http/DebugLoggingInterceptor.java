package org.jagriti.casesearch.http;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

public class DebugLoggingInterceptor implements ClientHttpRequestInterceptor {
    private static final Logger log = LoggerFactory.getLogger(DebugLoggingInterceptor.class);

    @Override
    public ClientHttpResponse intercept(final HttpRequest request, final byte[] body, final ClientHttpRequestExecution execution)
            throws IOException {
        final long started = System.nanoTime();
        if (log.isDebugEnabled()) {
            log.debug("Upstream {} {}", request.getMethod(), request.getURI());
            log.debug("Headers: {}", request.getHeaders());
            if (body.length > 0) {
                log.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }
        final ClientHttpResponse response = execution.execute(request, body);
        if (log.isDebugEnabled()) {
            log.debug("Upstream response {} in {} ms", response.getStatusCode(),
                    (System.nanoTime() - started) / 1_000_000);
        }
        return response;
    }
}
