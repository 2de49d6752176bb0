package org.jagriti.casesearch.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpResponse;

@ExtendWith(MockitoExtension.class)
class DebugLoggingInterceptorTest {

    @Mock
    private HttpRequest request;
    @Mock
    private ClientHttpRequestExecution execution;
    @Mock
    private ClientHttpResponse response;

    private DebugLoggingInterceptor interceptor;

    @BeforeEach
    void setUp() {
        interceptor = new DebugLoggingInterceptor();
    }

    @Test
    void testIntercept_executesRequestAndReturnsResponse() throws IOException {
        final byte[] body = "{\"serchType\":2}".getBytes();

        when(execution.execute(request, body)).thenReturn(response);

        final ClientHttpResponse result = interceptor.intercept(request, body, execution);

        verify(execution, times(1)).execute(request, body);
        assertEquals(response, result);
    }
}
