package com.example.shield.alert;

import com.example.shield.model.SecurityAlert;
import reactor.core.publisher.Mono;

/**
 * Destination for newly opened alerts.
 */
public interface AlertSink {

    String name();

    boolean accepts(SecurityAlert alert);

    Mono<Void> deliver(SecurityAlert alert);
}
