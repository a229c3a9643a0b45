package com.example.shield.alert;

import com.example.shield.model.SecurityAlert;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Fans an alert out to every accepting sink in the background. A failing
 * sink is reported through the failure callback and never affects the
 * caller or the other sinks.
 */
@Slf4j
public class AlertDispatcher {

    private final List<AlertSink> sinks;

    public AlertDispatcher(List<AlertSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public void dispatch(SecurityAlert alert, BiConsumer<AlertSink, Throwable> onFailure) {
        Flux.fromIterable(sinks)
                .filter(sink -> sink.accepts(alert))
                .flatMap(sink -> sink.deliver(alert)
                        .onErrorResume(error -> {
                            log.warn("Alert {} could not be delivered to {}: {}",
                                    alert.getId(), sink.name(), error.toString());
                            onFailure.accept(sink, error);
                            return Mono.empty();
                        }))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        null,
                        error -> log.error("Alert dispatch failed for {}", alert.getId(), error));
    }

    public List<AlertSink> getSinks() {
        return sinks;
    }
}
