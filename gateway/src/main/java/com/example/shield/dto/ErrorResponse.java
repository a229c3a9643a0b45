package com.example.shield.dto;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

public record ErrorResponse(HttpStatus status, HttpHeaders headers, ErrorEnvelope body) {
}
