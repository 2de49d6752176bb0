package org.jagriti.casesearch.config;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts the caller's correlation id (or a fresh one) into the MDC for the lifetime of the request
 * and echoes it on the response.
 */
@Component("correlationMdcFilter")
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestContextFilter implements Filter {

    public static final String CORRELATION_HEADER = "X-Correlation-Id";
    public static final String MDC_CORRELATION_ID = "correlationId";

    private static final String CLUSTER = System.getenv().getOrDefault("CLUSTER_NAME", "local");

    @Override
    public void doFilter(final ServletRequest req, final ServletResponse res, final FilterChain chain)
            throws IOException, ServletException {
        try {
            final HttpServletRequest httpServletRequest = (HttpServletRequest) req;
            String cid = httpServletRequest.getHeader(CORRELATION_HEADER);
            if (cid == null || cid.isBlank()) {
                cid = UUID.randomUUID().toString();
            }
            MDC.put(MDC_CORRELATION_ID, cid);
            MDC.put("cluster", CLUSTER);
            MDC.put("method", httpServletRequest.getMethod());
            MDC.put("path", httpServletRequest.getRequestURI());
            if (res instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(CORRELATION_HEADER, cid);
            }
            chain.doFilter(req, res);
        } finally {
            MDC.clear();
        }
    }
}
