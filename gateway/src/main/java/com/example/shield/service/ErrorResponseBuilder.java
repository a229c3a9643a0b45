package com.example.shield.service;

import com.example.shield.dto.ErrorEnvelope;
import com.example.shield.dto.ErrorResponse;
import com.example.shield.dto.RateLimitResult;
import com.example.shield.dto.SecurityFailure;
import com.example.shield.model.ErrorKind;
import com.example.shield.util.MessageRedactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * Turns a {@link SecurityFailure} into the HTTP response the caller sees:
 * status, headers and a redacted JSON envelope. Server-side kinds never
 * expose their message or details.
 */
@Service
@Slf4j
public class ErrorResponseBuilder {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private static final Pattern REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, LongAdder> errorCounts = new ConcurrentHashMap<>();

    public ErrorResponseBuilder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ErrorResponse build(SecurityFailure failure, String requestId) {
        ErrorKind kind = failure.getKind() != null ? failure.getKind() : ErrorKind.UNEXPECTED;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(REQUEST_ID_HEADER, requestId);

        Rendering rendering = switch (kind) {
            case RATE_LIMIT -> renderRateLimit(failure, headers);
            case VALIDATION, AUTH, AUTHORIZATION, CSRF, UPLOAD ->
                    new Rendering(publicMessage(failure, kind), sanitize(failure.getDetails()));
            case STORAGE, UNEXPECTED -> new Rendering(kind.getPublicMessage(), null);
        };

        errorCounts.computeIfAbsent(kind.getCode(), code -> new LongAdder()).increment();
        if (failure.getInternalDetail() != null) {
            log.debug("Request {} rejected with {}: {}", requestId, kind.getCode(), failure.getInternalDetail());
        }

        ErrorEnvelope body = new ErrorEnvelope(kind.getCode(), MessageRedactor.redact(rendering.message()),
                rendering.details(), Instant.now(clock).toString(), requestId);
        return new ErrorResponse(kind.getStatus(), headers, body);
    }

    private Rendering renderRateLimit(SecurityFailure failure, HttpHeaders headers) {
        Map<String, Object> details = sanitize(failure.getDetails());
        RateLimitResult rateLimit = failure.getRateLimit();
        if (rateLimit != null) {
            long retryAfter = rateLimit.retryAfterSeconds(clock.millis());
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
            applyRateLimitHeaders(headers, rateLimit);
            if (details == null) {
                details = new LinkedHashMap<>();
            }
            details.put("retryAfter", retryAfter);
        }
        return new Rendering(publicMessage(failure, ErrorKind.RATE_LIMIT), details);
    }

    /**
     * The caller's {@code X-Request-ID} when it is well formed, otherwise a fresh one.
     */
    public static String requestIdFrom(HttpHeaders headers) {
        String supplied = headers.getFirst(REQUEST_ID_HEADER);
        if (supplied != null && REQUEST_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }

    public static void applyRateLimitHeaders(HttpHeaders headers, RateLimitResult rateLimit) {
        headers.set(LIMIT_HEADER, String.valueOf(rateLimit.getLimit()));
        headers.set(REMAINING_HEADER, String.valueOf(rateLimit.getRemaining()));
        headers.set(RESET_HEADER, Instant.ofEpochMilli(rateLimit.getResetAtMillis()).toString());
    }

    private static String publicMessage(SecurityFailure failure, ErrorKind kind) {
        String message = failure.getPublicMessage();
        return message != null && !message.isBlank() ? message : kind.getPublicMessage();
    }

    private static Map<String, Object> sanitize(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        Map<String, Object> sanitized = new LinkedHashMap<>();
        details.forEach((key, value) -> sanitized.put(key, sanitizeValue(value)));
        return sanitized;
    }

    private static Object sanitizeValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(ErrorResponseBuilder::sanitizeValue).toList();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, nestedValue) -> nested.put(String.valueOf(key), sanitizeValue(nestedValue)));
            return nested;
        }
        return MessageRedactor.redact(value.toString());
    }

    public Mono<Void> write(ServerHttpResponse response, ErrorResponse error) {
        response.setStatusCode(error.status());
        response.getHeaders().putAll(error.headers());
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(error.body());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error envelope for request {}", error.body().requestId(), e);
            bytes = ("{\"code\":\"" + error.body().code() + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }

    public Map<String, Long> getErrorStats() {
        Map<String, Long> stats = new TreeMap<>();
        errorCounts.forEach((code, count) -> stats.put(code, count.sum()));
        return stats;
    }

    private record Rendering(String message, Map<String, Object> details) {
    }
}
