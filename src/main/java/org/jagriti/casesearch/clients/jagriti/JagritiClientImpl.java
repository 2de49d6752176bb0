package org.jagriti.casesearch.clients.jagriti;

import org.jagriti.casesearch.clients.jagriti.dto.CaseSearchPayload;
import org.jagriti.casesearch.clients.jagriti.dto.JagritiCaseDetail;
import org.jagriti.casesearch.clients.jagriti.dto.JagritiCommission;
import org.jagriti.casesearch.clients.jagriti.dto.JagritiEnvelope;
import org.jagriti.casesearch.clients.jagriti.mapper.JagritiDtoMapper;
import org.jagriti.casesearch.domain.CommissionEntry;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JacksonException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Slf4j
public class JagritiClientImpl implements JagritiClient {

    private static final ParameterizedTypeReference<JagritiEnvelope<JagritiCommission>> COMMISSIONS =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<JagritiEnvelope<JagritiCaseDetail>> CASES =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;
    private final RetryTemplate retryTemplate;
    private final JagritiDtoMapper mapper;
    private final String statesPath;
    private final String districtsPath;
    private final String caseSearchPath;
    private final Map<String, String> browserHeaders;
    private final int maxAttempts;

    public JagritiClientImpl(final RestClient restClient,
                             final JagritiClientProperties props,
                             final RetryTemplate retryTemplate,
                             final JagritiDtoMapper mapper) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.retryTemplate = Objects.requireNonNull(retryTemplate, "retryTemplate");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.statesPath = Objects.requireNonNull(props.statesPath(), "statesPath");
        this.districtsPath = Objects.requireNonNull(props.districtsPath(), "districtsPath");
        this.caseSearchPath = Objects.requireNonNull(props.caseSearchPath(), "caseSearchPath");
        this.browserHeaders = props.headers();
        this.maxAttempts = props.maxRetries();
    }

    @Override
    public List<CommissionEntry> fetchStateDirectory() {
        final JagritiEnvelope<JagritiCommission> envelope = exchange("state directory", () ->
                restClient.get()
                        .uri(uriBuilder -> uriBuilder.path(statesPath).build())
                        .headers(this::applyBrowserHeaders)
                        .retrieve()
                        .onStatus(status -> !status.is2xxSuccessful(), JagritiClientImpl::raiseHttpError)
                        .body(COMMISSIONS));
        return mapper.toCommissionEntries(envelope.data());
    }

    @Override
    public List<CommissionEntry> fetchDistrictDirectory(final int stateCommissionId) {
        final JagritiEnvelope<JagritiCommission> envelope = exchange("district directory", () ->
                restClient.get()
                        .uri(uriBuilder -> uriBuilder.path(districtsPath)
                                .queryParam("commissionId", stateCommissionId)
                                .build())
                        .headers(this::applyBrowserHeaders)
                        .retrieve()
                        .onStatus(status -> !status.is2xxSuccessful(), JagritiClientImpl::raiseHttpError)
                        .body(COMMISSIONS));
        return mapper.toCommissionEntries(envelope.data());
    }

    @Override
    public List<JagritiCaseDetail> executeSearch(final CaseSearchPayload payload) {
        log.info("Searching Jagriti cases with criteria: {}", payload);
        final JagritiEnvelope<JagritiCaseDetail> envelope = exchange("case search", () ->
                restClient.post()
                        .uri(uriBuilder -> uriBuilder.path(caseSearchPath).build())
                        .headers(this::applyBrowserHeaders)
                        .body(payload)
                        .retrieve()
                        .onStatus(status -> !status.is2xxSuccessful(), JagritiClientImpl::raiseHttpError)
                        .body(CASES));
        return mapper.checkCaseDetails(envelope.data());
    }

    /**
     * Runs one upstream call under the retry template. Only {@link ResourceAccessException} is
     * retried; HTTP errors and unreadable bodies fail on the first attempt.
     */
    private <T> JagritiEnvelope<T> exchange(final String operation,
                                            final Supplier<JagritiEnvelope<T>> call) {
        final JagritiEnvelope<T> envelope;
        try {
            envelope = retryTemplate.execute(context -> {
                log.info("Calling Jagriti {} (attempt {})", operation, context.getRetryCount() + 1);
                try {
                    return call.get();
                } catch (ResourceAccessException e) {
                    log.warn("Transport failure on Jagriti {} attempt {}: {}",
                            operation, context.getRetryCount() + 1, e.getMessage());
                    throw e;
                } catch (RestClientException e) {
                    final IOException transportCause = transportCause(e);
                    if (transportCause != null) {
                        log.warn("Transport failure reading Jagriti {} response on attempt {}: {}",
                                operation, context.getRetryCount() + 1, transportCause.toString());
                        throw new ResourceAccessException(
                                "I/O error reading Jagriti " + operation + " response: " + transportCause.getMessage(),
                                transportCause);
                    }
                    log.error("Unreadable response from Jagriti {}: {}", operation, e.getMessage());
                    throw new MalformedUpstreamResponseException(
                            "Unreadable response from Jagriti " + operation, e);
                }
            });
        } catch (ResourceAccessException e) {
            throw exhausted(operation, e);
        }

        if (envelope == null || envelope.data() == null) {
            log.error("Jagriti {} returned no data list", operation);
            throw new MalformedUpstreamResponseException("Jagriti " + operation + " returned no data list");
        }
        log.debug("Jagriti {} returned {} rows", operation, envelope.data().size());
        return envelope;
    }

    private JagritiApiException exhausted(final String operation, final ResourceAccessException e) {
        if (ExceptionUtils.indexOfType(e, InterruptedIOException.class) >= 0) {
            log.error("Jagriti {} timed out after {} attempts", operation, maxAttempts);
            return new UpstreamTimeoutException(operation, maxAttempts, e);
        }
        log.error("Jagriti {} unreachable after {} attempts", operation, maxAttempts);
        return new UpstreamUnreachableException(operation, maxAttempts, e);
    }

    /**
     * Socket-level failure hidden inside a body extraction error, if any. Jackson parse errors are
     * also {@link IOException}s but describe the payload, not the connection.
     */
    static IOException transportCause(final RestClientException e) {
        for (final Throwable cause : ExceptionUtils.getThrowableList(e)) {
            if (cause instanceof IOException io && !(cause instanceof JacksonException)) {
                return io;
            }
        }
        return null;
    }

    private void applyBrowserHeaders(final HttpHeaders headers) {
        browserHeaders.forEach(headers::set);
    }

    private static void raiseHttpError(final HttpRequest request, final ClientHttpResponse response)
            throws IOException {
        final int status = response.getStatusCode().value();
        final String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        log.error("HTTP error {} from {}: {}", status, request.getURI(), body);
        throw new UpstreamHttpException(status, body);
    }
}
