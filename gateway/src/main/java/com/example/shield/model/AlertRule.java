package com.example.shield.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {
    private String name;
    private SecurityEventType eventType;
    private CorrelationField groupBy = CorrelationField.SOURCE_IP;
    private int threshold;
    private Duration window;
    private AlertCategory category;
    private Severity severity;
    private String title;
}
