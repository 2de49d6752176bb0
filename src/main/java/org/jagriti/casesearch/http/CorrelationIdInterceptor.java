package org.jagriti.casesearch.http;

import org.jagriti.casesearch.config.RequestContextFilter;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Carries the inbound correlation id onto outbound calls so portal round trips can be tied back
 * to the request that caused them.
 */
public class CorrelationIdInterceptor implements ClientHttpRequestInterceptor {
    public static final String HEADER = "X-Request-ID";

    @Override
    public ClientHttpResponse intercept(final HttpRequest request, final byte[] body, final ClientHttpRequestExecution execution)
            throws IOException {
        String cid = MDC.get(RequestContextFilter.MDC_CORRELATION_ID);
        final boolean generated = cid == null || cid.isBlank();
        if (generated) {
            cid = UUID.randomUUID().toString();
            MDC.put(RequestContextFilter.MDC_CORRELATION_ID, cid);
        }
        if (request.getHeaders().getFirst(HEADER) == null) {
            request.getHeaders().add(HEADER, cid);
        }
        try {
            return execution.execute(request, body);
        } finally {
            if (generated) {
                MDC.remove(RequestContextFilter.MDC_CORRELATION_ID);
            }
        }
    }
}
