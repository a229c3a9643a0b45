package com.example.shield.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorEnvelope(String code, String message, Object details, String timestamp, String requestId) {
}
