package org.jagriti.casesearch.http;

import java.time.Duration;
import java.util.Map;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class RestClientFactoryConfig {

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager httpClientConnectionManager() {
        return PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(100)
                .setMaxConnPerRoute(20)
                .build();
    }

    @Bean
    public RestClientFactory restClientFactory(final PoolingHttpClientConnectionManager connectionManager) {
        return new RestClientFactory(connectionManager);
    }

    public static class RestClientFactory {

        private final PoolingHttpClientConnectionManager connectionManager;

        public RestClientFactory(final PoolingHttpClientConnectionManager connectionManager) {
            this.connectionManager = connectionManager;
        }

        /**
         * Builds a client whose connect, pool-lease and response timeouts all equal
         * {@code timeout}. HttpClient's own retries are disabled; retrying is the caller's job.
         */
        public RestClient build(final String baseUrl,
                                final Map<String, String> defaultHeaders,
                                final Duration timeout,
                                final boolean enableDebugLogging) {

            final RequestConfig requestConfig = RequestConfig.custom()
                    .setConnectTimeout(Timeout.of(timeout))
                    .setConnectionRequestTimeout(Timeout.of(timeout))
                    .setResponseTimeout(Timeout.of(timeout))
                    .build();

            final CloseableHttpClient httpClient = HttpClients.custom()
                    .setConnectionManager(connectionManager)
                    .setConnectionManagerShared(true)
                    .setDefaultRequestConfig(requestConfig)
                    .evictExpiredConnections()
                    .evictIdleConnections(TimeValue.ofSeconds(30))
                    .disableAutomaticRetries()
                    .build();

            final ClientHttpRequestFactory requestFactory =
                    new HttpComponentsClientHttpRequestFactory(httpClient);

            final RestClient.Builder builder = RestClient.builder()
                    .baseUrl(baseUrl)
                    .requestFactory(requestFactory)
                    .requestInterceptor(new CorrelationIdInterceptor());

            if (enableDebugLogging) {
                builder.requestInterceptor(new DebugLoggingInterceptor());
            }
            if (defaultHeaders != null && !defaultHeaders.isEmpty()) {
                defaultHeaders.forEach(builder::defaultHeader);
            }

            return builder.build();
        }
    }
}
