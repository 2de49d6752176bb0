package org.jagriti.casesearch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class RequestContextFilterTest {
    @Mock
    private HttpServletRequest request;
    @Mock
    private HttpServletResponse response;
    @Mock
    private FilterChain chain;

    private RequestContextFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RequestContextFilter();
    }

    @AfterEach
    void tearDown() {
        MDC.clear(); // Ensure no MDC leakage between tests
    }

    @Test
    void setsCorrelationIdFromHeaderAndMdcValues() throws IOException, ServletException {
        final String cid = UUID.randomUUID().toString();
        when(request.getHeader("X-Correlation-Id")).thenReturn(cid);
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/cases/by-complainant");

        doAnswer(invocation -> {
            // This is executed *during* the filter
            assertEquals(cid, MDC.get("correlationId"));
            assertEquals(System.getenv().getOrDefault("CLUSTER_NAME", "local"), MDC.get("cluster"));
            assertEquals("POST", MDC.get("method"));
            assertEquals("/cases/by-complainant", MDC.get("path"));
            return null;
        }).when(chain).doFilter(request, response);

        filter.doFilter(request, response, chain);

        verify(response).setHeader("X-Correlation-Id", cid);
        assertNull(MDC.get("correlationId"));
    }

    @Test
    void generatesCorrelationIdWhenHeaderMissing() throws IOException, ServletException {
        when(request.getHeader("X-Correlation-Id")).thenReturn(null);
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/states");

        doAnswer(invocation -> {
            assertNotNull(MDC.get("correlationId"));
            return null;
        }).when(chain).doFilter(request, response);

        filter.doFilter(request, response, chain);

        verify(response).setHeader(eq("X-Correlation-Id"), anyString());
    }

    @Test
    void clearsMdcWhenChainThrows() throws IOException, ServletException {
        when(request.getHeader("X-Correlation-Id")).thenReturn("abc");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/states");
        doThrow(new ServletException("boom")).when(chain).doFilter(request, response);

        assertThrows(ServletException.class, () -> filter.doFilter(request, response, chain));
        assertNull(MDC.get("correlationId"));
    }
}
