package com.example.shield.config;

import com.example.shield.alert.AlertCorrelator;
import com.example.shield.alert.AlertDispatcher;
import com.example.shield.alert.AlertSink;
import com.example.shield.alert.LoggingAlertSink;
import com.example.shield.alert.WebhookAlertSink;
import com.example.shield.store.InMemoryRateWindowStore;
import com.example.shield.store.RateWindowStore;
import com.example.shield.store.RedisRateWindowStore;
import com.example.shield.store.SecurityAlertStore;
import com.example.shield.store.SecurityEventLog;
import com.example.shield.util.SignatureCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class ShieldConfig {

    private static final String DEFAULT_CSRF_SECRET = "default-csrf-secret-change-in-production";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SignatureCodec csrfSignatureCodec(ShieldProperties properties) {
        String secret = properties.getCsrf().getSecret();
        if (DEFAULT_CSRF_SECRET.equals(secret)) {
            log.warn("CSRF tokens are signed with the built-in default secret; set shield.csrf.secret");
        }
        return new SignatureCodec(secret);
    }

    @Bean
    public RateWindowStore rateWindowStore(ShieldProperties properties,
                                           ObjectProvider<ReactiveStringRedisTemplate> redisTemplate) {
        String store = properties.getRateLimit().getStore();
        if ("redis".equalsIgnoreCase(store)) {
            log.info("Rate limit windows stored in Redis");
            return new RedisRateWindowStore(redisTemplate.getObject());
        }
        if (!"memory".equalsIgnoreCase(store)) {
            throw new IllegalStateException("Unknown shield.rate-limit.store: " + store);
        }
        log.info("Rate limit windows stored in process memory");
        return new InMemoryRateWindowStore();
    }

    @Bean
    public SecurityEventLog securityEventLog(ShieldProperties properties) {
        return new SecurityEventLog(properties.getMonitor().getMaxEvents());
    }

    @Bean
    public SecurityAlertStore securityAlertStore(ShieldProperties properties) {
        return new SecurityAlertStore(properties.getMonitor().getMaxAlerts());
    }

    @Bean
    public AlertCorrelator alertCorrelator(ShieldProperties properties) {
        return new AlertCorrelator(properties.getMonitor().getRules());
    }

    @Bean
    public AlertDispatcher alertDispatcher(ShieldProperties properties, WebClient.Builder webClientBuilder) {
        ShieldProperties.Monitor monitor = properties.getMonitor();
        List<AlertSink> sinks = new ArrayList<>();
        sinks.add(new LoggingAlertSink());
        if (monitor.getWebhookUrl() != null && !monitor.getWebhookUrl().isBlank()) {
            sinks.add(new WebhookAlertSink(webClientBuilder.build(), monitor.getWebhookUrl(),
                    monitor.getWebhookTimeout(), monitor.getWebhookRetries()));
            log.info("Critical alerts will be posted to the configured webhook");
        }
        return new AlertDispatcher(sinks);
    }
}
