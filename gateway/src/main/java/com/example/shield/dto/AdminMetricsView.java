package com.example.shield.dto;

import com.example.shield.service.AnalyticsService;

import java.util.Map;

public record AdminMetricsView(SecurityMetrics security,
                               AnalyticsService.PipelineSummary pipeline,
                               Map<String, Long> errorsByCode,
                               RateLimitStats rateLimits) {
}
