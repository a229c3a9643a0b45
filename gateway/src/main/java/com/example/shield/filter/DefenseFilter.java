package com.example.shield.filter;

import com.example.shield.dto.ErrorResponse;
import com.example.shield.dto.PipelineDecision;
import com.example.shield.dto.RequestContext;
import com.example.shield.model.ClientIdentity;
import com.example.shield.model.PipelineStage;
import com.example.shield.model.SecurityEvent;
import com.example.shield.model.SecurityEventType;
import com.example.shield.service.AnalyticsService;
import com.example.shield.service.ConfigurationService;
import com.example.shield.service.DefensePipeline;
import com.example.shield.service.ErrorResponseBuilder;
import com.example.shield.service.SecurityHeadersService;
import com.example.shield.service.SecurityMonitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Set;

/**
 * Gateway entry point for the defense pipeline. Rejected requests get the
 * error envelope and never reach the upstream; admitted ones are forwarded
 * with rate-limit and security headers attached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefenseFilter implements GlobalFilter, Ordered {

    private static final Set<HttpMethod> BODY_METHODS = Set.of(HttpMethod.POST, HttpMethod.PUT, HttpMethod.PATCH);
    private static final List<String> SENSITIVE_PREFIXES = List.of("/api/auth/", "/api/admin/", "/api/upload/");

    private final DefensePipeline pipeline;
    private final ErrorResponseBuilder errorResponseBuilder;
    private final SecurityHeadersService headersService;
    private final SecurityMonitorService monitor;
    private final AnalyticsService analyticsService;
    private final ConfigurationService configService;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        // Body is read once here and replayed to the upstream
        if (BODY_METHODS.contains(exchange.getRequest().getMethod())) {
            return ServerWebExchangeUtils.cacheRequestBody(exchange, cachedRequest -> {
                ServerWebExchange cachedExchange = exchange.mutate().request(cachedRequest).build();
                return defend(cachedExchange, chain);
            });
        }
        return defend(exchange, chain);
    }

    private Mono<Void> defend(ServerWebExchange exchange, GatewayFilterChain chain) {
        String requestId = ErrorResponseBuilder.requestIdFrom(exchange.getRequest().getHeaders());
        RequestContext request = RequestContext.from(exchange.getRequest(), cachedBody(exchange), requestId);
        logSensitiveRequest(request);

        return pipeline.evaluate(request)
                .onErrorResume(error -> {
                    log.error("Defense pipeline raised for request {}, admitting", requestId, error);
                    return Mono.just(PipelineDecision.builder()
                            .requestId(requestId)
                            .admitted(true)
                            .decidedAt(PipelineStage.ENTRY)
                            .failedOpen(true)
                            .build());
                })
                .flatMap(decision -> {
                    analyticsService.record(decision);
                    ServerHttpResponse response = exchange.getResponse();
                    headersService.apply(response.getHeaders());
                    if (!decision.isAdmitted()) {
                        ErrorResponse error = errorResponseBuilder.build(decision.getFailure(), requestId);
                        return errorResponseBuilder.write(response, error);
                    }
                    response.getHeaders().set(ErrorResponseBuilder.REQUEST_ID_HEADER, requestId);
                    if (decision.getRateLimit() != null) {
                        ErrorResponseBuilder.applyRateLimitHeaders(response.getHeaders(), decision.getRateLimit());
                    }
                    observeLogin(exchange, request, decision.getClient());
                    return chain.filter(exchange);
                });
    }

    /**
     * Records a login failure when the upstream answers a login path with 401.
     */
    private void observeLogin(ServerWebExchange exchange, RequestContext request, ClientIdentity client) {
        if (!pipeline.isLoginPath(request.getPath())) {
            return;
        }
        ServerHttpResponse response = exchange.getResponse();
        response.beforeCommit(() -> Mono.fromRunnable(() -> {
            if (HttpStatus.UNAUTHORIZED.equals(response.getStatusCode())) {
                monitor.logEvent(SecurityEvent.of(SecurityEventType.LOGIN_FAILURE)
                        .sourceIp(client != null ? client.ip() : null)
                        .userAgent(request.userAgent())
                        .detail("path", request.getPath())
                        .detail("requestId", request.getRequestId())
                        .build());
            }
        }));
    }

    private void logSensitiveRequest(RequestContext request) {
        if (!configService.isEnabled(ConfigurationService.SECURITY_LOGGING_ENABLED)) {
            return;
        }
        String path = request.getPath();
        if (path != null && SENSITIVE_PREFIXES.stream().anyMatch(path::startsWith)) {
            log.info("Sensitive request {} {} {} ua={}", request.getRequestId(), request.getMethod(), path,
                    request.userAgent());
        }
    }

    private static byte[] cachedBody(ServerWebExchange exchange) {
        Object cached = exchange.getAttribute(ServerWebExchangeUtils.CACHED_REQUEST_BODY_ATTR);
        if (cached instanceof byte[] bytes) {
            return bytes;
        }
        if (cached instanceof DataBuffer buffer) {
            // copy without moving the read position; the buffer is replayed upstream
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.toByteBuffer(buffer.readPosition(), ByteBuffer.wrap(bytes), 0, bytes.length);
            return bytes;
        }
        return null;
    }

    @Override
    public int getOrder() {
        return -1;
    }
}
