package com.example.shield.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitTier {
    private String name;
    private String pathPattern;
    private int priority;  // lower = evaluated first
    private long windowMs;
    private int maxRequests;
}
