package org.jagriti.casesearch.clients.jagriti;

import org.jagriti.casesearch.clients.jagriti.mapper.JagritiDtoMapper;
import org.jagriti.casesearch.http.RestClientFactoryConfig.RestClientFactory;

import java.util.Map;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(JagritiClientProperties.class)
public class JagritiClientConfig {

    @Bean
    public RestClient jagritiRestClient(final RestClientFactory factory, final JagritiClientProperties properties) {
        return factory.build(
                properties.baseUrl(),
                null,
                properties.requestTimeout(),
                properties.debugLogging()
        );
    }

    @Bean
    public RetryTemplate jagritiRetryTemplate(final JagritiClientProperties properties) {
        return retryTemplate(properties, new ThreadWaitSleeper());
    }

    @Bean
    public JagritiClient jagritiClient(@Qualifier("jagritiRestClient") final RestClient restClient,
                                       final JagritiClientProperties properties,
                                       @Qualifier("jagritiRetryTemplate") final RetryTemplate retryTemplate,
                                       final JagritiDtoMapper mapper) {
        return new JagritiClientImpl(restClient, properties, retryTemplate, mapper);
    }

    /**
     * At most {@code maxRetries} attempts; transport failures only. The wait before retry
     * {@code n} (0-based) is {@code 2^n} backoff units.
     */
    public static RetryTemplate retryTemplate(final JagritiClientProperties properties, final Sleeper sleeper) {
        final RetryTemplate retryTemplate = new RetryTemplate();

        final SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(
                properties.maxRetries(),
                Map.of(ResourceAccessException.class, true),
                true
        );

        final long unit = properties.backoffUnitMs();
        final ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(unit);
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(unit << Math.min(properties.maxRetries(), 20));
        backOffPolicy.setSleeper(sleeper);

        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);
        return retryTemplate;
    }
}
