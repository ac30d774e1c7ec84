package com.github.dimitryivaniuta.eventreg.server.web;

import com.github.dimitryivaniuta.eventreg.common.error.ForbiddenException;
import com.github.dimitryivaniuta.eventreg.common.error.NotFoundException;
import com.github.dimitryivaniuta.eventreg.common.error.RegistrationException;
import com.github.dimitryivaniuta.eventreg.common.error.UnauthenticatedException;
import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import java.time.Instant;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures to {@link ApiError} responses. Internal failures are logged with their cause
 * and reported generically.
 */
@Slf4j
@RestControllerAdvice
public class GlobalErrorHandler {

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ApiError> unauthenticated(final UnauthenticatedException e) {
        return respond(HttpStatus.UNAUTHORIZED, ApiError.of(e.code(), e.getMessage()));
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiError> forbidden(final ForbiddenException e) {
        return respond(HttpStatus.FORBIDDEN, ApiError.of(e.code(), e.getMessage()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> invalid(final ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, ApiError.builder()
                .code(e.code())
                .message(e.getMessage())
                .timestamp(Instant.now())
                .details(Map.of("field", e.getField()))
                .build());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> notFound(final NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, ApiError.builder()
                .code(e.code())
                .message(e.getMessage())
                .timestamp(Instant.now())
                .details(Map.of("id", e.getId()))
                .build());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> bind(final WebExchangeBindException e) {
        final FieldError first = e.getFieldError();
        final String field = first == null ? "body" : first.getField();
        final ValidationException mapped = ValidationException.empty(field);
        return invalid(mapped);
    }

    @ExceptionHandler({ServerWebInputException.class, DecodingException.class})
    public ResponseEntity<ApiError> unreadable(final Exception e) {
        log.debug("Unreadable request body", e);
        return invalid(ValidationException.invalidValue("body"));
    }

    /** Store failures and missing signing keys. */
    @ExceptionHandler(RegistrationException.class)
    public ResponseEntity<ApiError> internal(final RegistrationException e, final ServerWebExchange exchange) {
        log.error("Request failed code={} path={} correlationId={}", e.code(),
                exchange.getRequest().getPath(), exchange.getAttribute(CorrelationIdFilter.ATTR_CORRELATION_ID), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.of("internal", "internal error"));
    }

    private static ResponseEntity<ApiError> respond(final HttpStatus status, final ApiError body) {
        return ResponseEntity.status(status).body(body);
    }
}
