package com.example.shield.dto;

import com.example.shield.model.ErrorKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A classified failure travelling through the pipeline as data.
 * {@code internalDetail} is for logs and events only and is never rendered
 * to the caller.
 */
@Value
@Builder
public class SecurityFailure {
    ErrorKind kind;
    String publicMessage;
    String internalDetail;
    @Singular
    Map<String, Object> details;
    RateLimitResult rateLimit;

    public static SecurityFailure of(ErrorKind kind) {
        return builder().kind(kind).build();
    }
}
