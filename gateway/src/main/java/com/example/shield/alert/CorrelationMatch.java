package com.example.shield.alert;

import com.example.shield.model.AlertRule;
import com.example.shield.model.SecurityEvent;

/**
 * A rule whose threshold was reached by {@code trigger}.
 *
 * @param correlationKey rule name plus the grouping value, e.g. {@code failed-logins|10.0.0.7}
 * @param actor          the grouping value itself
 * @param count          events inside the window, trigger included
 */
public record CorrelationMatch(AlertRule rule, String correlationKey, String actor, int count, SecurityEvent trigger) {
}
