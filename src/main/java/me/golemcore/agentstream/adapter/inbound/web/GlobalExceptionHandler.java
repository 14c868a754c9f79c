package me.golemcore.agentstream.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentstream.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.agentstream.domain.exception.AgentRunNotFoundException;
import me.golemcore.agentstream.domain.exception.GatewayTimeoutException;
import me.golemcore.agentstream.domain.exception.NoPendingApprovalException;
import me.golemcore.agentstream.domain.exception.RunValidationException;
import me.golemcore.agentstream.domain.service.ErrorSanitizer;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Centralized exception handler for HTTP controllers. Messages sent to clients
 * are whitelisted or sanitized.
 */
@ControllerAdvice(basePackages = "me.golemcore.agentstream.adapter.inbound.web.controller")
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final ErrorSanitizer errorSanitizer;

    @ExceptionHandler(RunValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleValidation(RunValidationException ex) {
        log.warn("[API] Validation failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "validation_error",
                errorSanitizer.safeValidationMessage(ex.getMessage()));
    }

    @ExceptionHandler(AgentRunNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(AgentRunNotFoundException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(NoPendingApprovalException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNoPendingApproval(NoPendingApprovalException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "no_pending_request", ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInput(ServerWebInputException ex) {
        log.warn("[API] Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "validation_error", "Invalid request format");
    }

    @ExceptionHandler(GatewayTimeoutException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGatewayTimeout(GatewayTimeoutException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "gateway_timeout", ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, status.name().toLowerCase(Locale.ROOT),
                errorSanitizer.sanitize(ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error: {}", errorSanitizer.describe(ex));
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String error, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
