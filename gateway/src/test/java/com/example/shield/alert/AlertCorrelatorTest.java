package com.example.shield.alert;

import com.example.shield.model.AlertCategory;
import com.example.shield.model.AlertRule;
import com.example.shield.model.CorrelationField;
import com.example.shield.model.SecurityEvent;
import com.example.shield.model.SecurityEventType;
import com.example.shield.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AlertCorrelatorTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private AlertCorrelator correlator;

    @BeforeEach
    void setUp() {
        correlator = new AlertCorrelator(List.of(
                new AlertRule("failed-logins", SecurityEventType.LOGIN_FAILURE, CorrelationField.SOURCE_IP,
                        3, Duration.ofMinutes(15), AlertCategory.AUTHENTICATION, Severity.HIGH, "Failed logins"),
                new AlertRule("admin-actions", SecurityEventType.ADMIN_ACTION, CorrelationField.USER_ID,
                        2, Duration.ofMinutes(60), AlertCategory.SECURITY_EVENT, Severity.MEDIUM, "Admin activity")));
    }

    private static SecurityEvent event(SecurityEventType type, String ip, String user, Instant at) {
        return SecurityEvent.of(type).sourceIp(ip).userId(user).timestamp(at).build();
    }

    @Test
    void testMatchOnceThresholdReached() {
        assertThat(correlator.correlate(event(SecurityEventType.LOGIN_FAILURE, "10.0.0.1", null, START))).isEmpty();
        assertThat(correlator.correlate(event(SecurityEventType.LOGIN_FAILURE, "10.0.0.1", null, START.plusSeconds(1))))
                .isEmpty();

        List<CorrelationMatch> matches = correlator.correlate(
                event(SecurityEventType.LOGIN_FAILURE, "10.0.0.1", null, START.plusSeconds(2)));

        assertThat(matches).singleElement().satisfies(match -> {
            assertThat(match.correlationKey()).isEqualTo("failed-logins|10.0.0.1");
            assertThat(match.actor()).isEqualTo("10.0.0.1");
            assertThat(match.count()).isEqualTo(3);
            assertThat(match.rule().getName()).isEqualTo("failed-logins");
        });
    }

    @Test
    void testEventsWithoutActorIgnored() {
        correlator.correlate(event(SecurityEventType.ADMIN_ACTION, "10.0.0.1", null, START));
        correlator.correlate(event(SecurityEventType.ADMIN_ACTION, "10.0.0.1", "", START));

        assertThat(correlator.trackedActors()).isZero();
    }

    @Test
    void testUnrelatedTypesIgnored() {
        correlator.correlate(event(SecurityEventType.FILE_UPLOAD, "10.0.0.1", "editor-1", START));

        assertThat(correlator.trackedActors()).isZero();
    }

    @Test
    void testSweepForgetsIdleActors() {
        correlator.correlate(event(SecurityEventType.LOGIN_FAILURE, "10.0.0.1", null, START));
        correlator.correlate(event(SecurityEventType.ADMIN_ACTION, "10.0.0.1", "editor-1", START));
        assertThat(correlator.trackedActors()).isEqualTo(2);

        assertThat(correlator.sweep(START.plus(Duration.ofMinutes(20)))).isEqualTo(1);
        assertThat(correlator.trackedActors()).isEqualTo(1);

        assertThat(correlator.sweep(START.plus(Duration.ofMinutes(61)))).isEqualTo(1);
        assertThat(correlator.trackedActors()).isZero();
    }
}
