package com.example.shield.alert;

import com.example.shield.model.SecurityAlert;
import com.example.shield.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts critical alerts to a chat-style incoming webhook.
 */
@Slf4j
public class WebhookAlertSink implements AlertSink {

    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);

    private final WebClient webClient;
    private final String webhookUrl;
    private final Duration timeout;
    private final int retries;

    public WebhookAlertSink(WebClient webClient, String webhookUrl, Duration timeout, int retries) {
        this.webClient = webClient;
        this.webhookUrl = webhookUrl;
        this.timeout = timeout;
        this.retries = retries;
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean accepts(SecurityAlert alert) {
        return alert.getSeverity() == Severity.CRITICAL;
    }

    @Override
    public Mono<Void> deliver(SecurityAlert alert) {
        return webClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload(alert))
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .retryWhen(Retry.backoff(retries, RETRY_BACKOFF))
                .doOnSuccess(response -> log.debug("Alert {} delivered to webhook", alert.getId()))
                .then();
    }

    Map<String, Object> payload(SecurityAlert alert) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", "danger");
        attachment.put("fields", List.of(
                field("Description", alert.getDescription(), false),
                field("Source IP", alert.getSourceIp() != null ? alert.getSourceIp() : "unknown", true),
                field("Timestamp", alert.getCreatedAt().toString(), true)));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", "Security Alert: " + alert.getTitle());
        body.put("attachments", List.of(attachment));
        return body;
    }

    private static Map<String, Object> field(String title, String value, boolean isShort) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", isShort);
        return field;
    }
}
