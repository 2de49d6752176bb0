package org.jagriti.casesearch.controllers;

import static org.jagriti.casesearch.util.TimeUtils.utcNow;

import org.jagriti.casesearch.clients.jagriti.JagritiApiException;
import org.jagriti.casesearch.controllers.dto.ErrorResponse;
import org.jagriti.casesearch.services.exception.CaseSearchException;
import org.jagriti.casesearch.services.exception.CommissionNotFoundException;
import org.jagriti.casesearch.services.exception.InvalidSearchCriteriaException;

import java.util.stream.Collectors;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Centralised exception mapping for REST controllers. Resolution misses become 404, rejected
 * input 400, and every upstream or internal failure 500.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Tracer tracer;

    private String traceId() {
        final Span span = tracer.currentSpan();
        return span != null ? span.context().traceId() : null;
    }

    private ResponseEntity<ErrorResponse> respond(final HttpStatusCode status, final String message) {
        final ErrorResponse err = new ErrorResponse(String.valueOf(status.value()), message, utcNow(), traceId());
        return ResponseEntity.status(status).body(err);
    }

    @ExceptionHandler(CommissionNotFoundException.class)
    public ResponseEntity<ErrorResponse> onNotFound(final CommissionNotFoundException notFound) {
        log.warn("{} lookup failed: {}", notFound.getKind(), notFound.getMessage());
        return respond(HttpStatus.NOT_FOUND, notFound.getMessage());
    }

    @ExceptionHandler(InvalidSearchCriteriaException.class)
    public ResponseEntity<ErrorResponse> onInvalidCriteria(final InvalidSearchCriteriaException invalid) {
        log.warn("Rejected search criteria: {}", invalid.getMessage());
        return respond(HttpStatus.BAD_REQUEST, invalid.getMessage());
    }

    @ExceptionHandler(JagritiApiException.class)
    public ResponseEntity<ErrorResponse> onUpstream(final JagritiApiException upstream) {
        log.error("Jagriti API error: {}", upstream.getMessage(), upstream);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "External API error: " + upstream.getMessage());
    }

    @ExceptionHandler(CaseSearchException.class)
    public ResponseEntity<ErrorResponse> onSearchFailure(final CaseSearchException failure) {
        log.error("Case search failed", failure);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, failure.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> onResponseStatus(final ResponseStatusException responseStatusException) {
        log.warn("ResponseStatusException status={} reason={}", responseStatusException.getStatusCode(), responseStatusException.getReason());
        return respond(responseStatusException.getStatusCode(),
                responseStatusException.getReason() != null ? responseStatusException.getReason() : responseStatusException.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> onValidation(final MethodArgumentNotValidException methodArgumentNotValidException) {
        final String details = methodArgumentNotValidException.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(GlobalExceptionHandler::formatFieldError)
                .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", details);
        return respond(HttpStatus.BAD_REQUEST, details);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> onTypeMismatch(final MethodArgumentTypeMismatchException mismatch) {
        log.warn("Bad value for {}: {}", mismatch.getName(), mismatch.getValue());
        return respond(HttpStatus.BAD_REQUEST, mismatch.getName() + " is invalid");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> onUnreadable(final HttpMessageNotReadableException httpMessageNotReadableException) {
        log.warn("Malformed request body: {}", httpMessageNotReadableException.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> onUnexpected(final Exception exception) {
        log.error("Unexpected error", exception);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static String formatFieldError(final FieldError fieldError) {
        return fieldError.getField() + " " + (fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "is invalid");
    }
}
