package com.example.shield.controller;

import com.example.shield.dto.ErrorEnvelope;
import com.example.shield.dto.ErrorResponse;
import com.example.shield.dto.SecurityFailure;
import com.example.shield.exception.ShieldException;
import com.example.shield.model.ErrorKind;
import com.example.shield.service.ErrorResponseBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;


/**
 * Renders controller failures with the same envelope the pipeline uses.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class ShieldExceptionHandler {

    private final ErrorResponseBuilder errorResponseBuilder;

    @ExceptionHandler(ShieldException.class)
    public ResponseEntity<ErrorEnvelope> handleShieldException(ShieldException e, ServerWebExchange exchange) {
        log.debug("Request failed with {}: {}", e.getKind(), e.getMessage());
        return render(SecurityFailure.builder()
                .kind(e.getKind())
                .publicMessage(e.getMessage())
                .build(), exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorEnvelope> handleInputException(ServerWebInputException e, ServerWebExchange exchange) {
        log.debug("Malformed request: {}", e.getReason());
        return render(SecurityFailure.builder()
                .kind(ErrorKind.VALIDATION)
                .internalDetail(e.getReason())
                .build(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorEnvelope> handleUnexpected(Exception e, ServerWebExchange exchange) {
        log.error("Unhandled error on {}", exchange.getRequest().getPath(), e);
        return render(SecurityFailure.builder()
                .kind(ErrorKind.UNEXPECTED)
                .internalDetail(e.toString())
                .build(), exchange);
    }

    private ResponseEntity<ErrorEnvelope> render(SecurityFailure failure, ServerWebExchange exchange) {
        String requestId = ErrorResponseBuilder.requestIdFrom(exchange.getRequest().getHeaders());
        ErrorResponse response = errorResponseBuilder.build(failure, requestId);
        return ResponseEntity.status(response.status())
                .headers(response.headers())
                .body(response.body());
    }
}
