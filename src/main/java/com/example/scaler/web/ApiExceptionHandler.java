package com.example.scaler.web;

import com.example.scaler.scaling.BackendUnavailableException;
import com.example.scaler.scaling.ScalingException;
import com.example.scaler.tasks.InvalidTaskRequestException;
import com.example.scaler.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;

import java.util.stream.Collectors;

/**
 * Maps poll and submission failures to JSON error bodies. A failed /metrics call never carries a metric value.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ScalingException.class)
    public ResponseEntity<ErrorResponse> scaling(ScalingException e, ServerWebExchange exchange) {
        HttpStatus status = e instanceof BackendUnavailableException
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.INTERNAL_SERVER_ERROR;
        String prefix = isMetrics(exchange) ? "Error computing metrics: " : "Error enqueuing workflow: ";

        log.error("scaler: {} {} failed with {}: {}", exchange.getRequest().getMethod(),
                exchange.getRequest().getPath(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(prefix + e.getMessage()));
    }

    @ExceptionHandler(InvalidTaskRequestException.class)
    public ResponseEntity<ErrorResponse> badRequest(InvalidTaskRequestException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> invalidBody(WebExchangeBindException e) {
        String msg = e.getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request: " + msg));
    }

    private static boolean isMetrics(ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        return path.startsWith("/metrics") || path.startsWith("/api/queues");
    }
}
