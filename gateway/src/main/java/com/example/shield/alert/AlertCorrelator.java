package com.example.shield.alert;

import com.example.shield.model.AlertRule;
import com.example.shield.model.SecurityEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding per-actor counts of recent events, one deque of timestamps per
 * {@code (rule, actor)}. Every mutation of a deque happens inside
 * {@link ConcurrentHashMap#compute}, so updates for one key are serialized
 * while different keys proceed in parallel.
 */
public class AlertCorrelator {

    private final List<AlertRule> rules;
    private final Map<String, AlertRule> rulesByName;
    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public AlertCorrelator(List<AlertRule> rules) {
        this.rules = List.copyOf(rules);
        this.rulesByName = new ConcurrentHashMap<>();
        for (AlertRule rule : rules) {
            rulesByName.put(rule.getName(), rule);
        }
    }

    /**
     * Records {@code event} against every rule for its type and returns the
     * rules whose threshold is now met.
     */
    public List<CorrelationMatch> correlate(SecurityEvent event) {
        List<CorrelationMatch> matches = new ArrayList<>(1);
        for (AlertRule rule : rules) {
            if (rule.getEventType() != event.getType()) {
                continue;
            }
            String actor = rule.getGroupBy().valueOf(event);
            if (actor == null || actor.isBlank()) {
                continue;
            }
            String key = rule.getName() + "|" + actor;
            Instant timestamp = event.getTimestamp();
            Instant horizon = timestamp.minus(rule.getWindow());
            int[] count = new int[1];
            windows.compute(key, (k, deque) -> {
                Deque<Instant> times = deque != null ? deque : new ArrayDeque<>();
                times.addLast(timestamp);
                trim(times, horizon);
                count[0] = times.size();
                return times;
            });
            if (count[0] >= rule.getThreshold()) {
                matches.add(new CorrelationMatch(rule, key, actor, count[0], event));
            }
        }
        return matches;
    }

    /**
     * Drops timestamps that fell out of their rule's window and forgets
     * actors with nothing left.
     *
     * @return number of actors forgotten
     */
    public int sweep(Instant now) {
        int forgotten = 0;
        for (String key : windows.keySet()) {
            AlertRule rule = rulesByName.get(key.substring(0, key.indexOf('|')));
            if (rule == null) {
                windows.remove(key);
                forgotten++;
                continue;
            }
            Instant horizon = now.minus(rule.getWindow());
            Deque<Instant> remaining = windows.computeIfPresent(key, (k, times) -> {
                trim(times, horizon);
                return times.isEmpty() ? null : times;
            });
            if (remaining == null) {
                forgotten++;
            }
        }
        return forgotten;
    }

    public int trackedActors() {
        return windows.size();
    }

    private static void trim(Deque<Instant> times, Instant horizon) {
        while (!times.isEmpty() && times.peekFirst().isBefore(horizon)) {
            times.pollFirst();
        }
    }
}
