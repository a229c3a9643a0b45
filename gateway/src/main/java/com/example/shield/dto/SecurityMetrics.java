package com.example.shield.dto;

import com.example.shield.model.SecurityEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityMetrics {
    private long totalEvents;
    private Map<String, Long> eventsByType;
    private Map<String, Long> eventsBySeverity;
    private List<SecurityEvent> recentEvents;
    private long alertsGenerated;
    private long openAlerts;
    private List<SourceCount> topSourceIps;
    private long suspiciousActivities;
    private long blockedRequests;

    public record SourceCount(String ip, long count) {
    }
}
