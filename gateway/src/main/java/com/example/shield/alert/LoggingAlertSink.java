package com.example.shield.alert;

import com.example.shield.model.SecurityAlert;
import com.example.shield.model.Severity;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@Slf4j
public class LoggingAlertSink implements AlertSink {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean accepts(SecurityAlert alert) {
        return true;
    }

    @Override
    public Mono<Void> deliver(SecurityAlert alert) {
        return Mono.fromRunnable(() -> {
            if (alert.getSeverity().isAtLeast(Severity.HIGH)) {
                log.error("SECURITY ALERT [{}] {}: {} (id={}, source={})", alert.getSeverity(), alert.getTitle(),
                        alert.getDescription(), alert.getId(), alert.getSourceIp());
            } else {
                log.warn("Security alert [{}] {}: {} (id={}, source={})", alert.getSeverity(), alert.getTitle(),
                        alert.getDescription(), alert.getId(), alert.getSourceIp());
            }
        });
    }
}
