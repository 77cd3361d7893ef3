package dev.matchengine.web;

import dev.matchengine.exception.EntityNotFoundException;
import dev.matchengine.exception.TenantMismatchException;
import dev.matchengine.exception.WeightValidationException;
import dev.matchengine.web.dto.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps domain exceptions to error responses. A tenant mismatch answers exactly
 * like a missing entity so callers learn nothing about other tenants.
 */
@ControllerAdvice(basePackages = "dev.matchengine.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    static final String NOT_FOUND_MESSAGE = "Not found";

    @ExceptionHandler({EntityNotFoundException.class, TenantMismatchException.class})
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(RuntimeException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, NOT_FOUND_MESSAGE);
    }

    @ExceptionHandler(WeightValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleWeightValidation(WeightValidationException ex) {
        log.warn("[API] Weight update rejected: {}", ex.getViolations());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message("Invalid weight configuration")
                .details(ex.getViolations())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
