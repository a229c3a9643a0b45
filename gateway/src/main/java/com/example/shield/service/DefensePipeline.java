package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.CsrfVerification;
import com.example.shield.dto.PipelineDecision;
import com.example.shield.dto.RateLimitResult;
import com.example.shield.dto.RequestContext;
import com.example.shield.dto.SecurityFailure;
import com.example.shield.dto.ThreatScanResult;
import com.example.shield.model.ClientIdentity;
import com.example.shield.model.ErrorKind;
import com.example.shield.model.PipelineStage;
import com.example.shield.model.RateLimitTier;
import com.example.shield.model.SecurityEvent;
import com.example.shield.model.SecurityEventType;
import com.example.shield.model.ThreatCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.AntPathMatcher;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Runs every inbound request through the defenses in a fixed order:
 * bypass check, rate limit, threat scan, CSRF. The first rejection ends the
 * evaluation. Anything unexpected, including running past the deadline,
 * admits the request and is recorded as a pipeline error.
 */
@Service
@Slf4j
public class DefensePipeline {

    static final String THREAT_BLOCKED_MESSAGE = "Request blocked due to suspicious activity";

    private final ConfigurationService configService;
    private final ClientIdentityResolver identityResolver;
    private final RateLimiterService rateLimiter;
    private final ThreatDetectionService threatDetector;
    private final CsrfGuard csrfGuard;
    private final SecurityMonitorService monitor;
    private final JwtService jwtService;
    private final ShieldProperties.Pipeline config;
    private final ShieldProperties.Threat threatConfig;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public DefensePipeline(ConfigurationService configService,
                           ClientIdentityResolver identityResolver,
                           RateLimiterService rateLimiter,
                           ThreatDetectionService threatDetector,
                           CsrfGuard csrfGuard,
                           SecurityMonitorService monitor,
                           JwtService jwtService,
                           ShieldProperties properties) {
        this.configService = configService;
        this.identityResolver = identityResolver;
        this.rateLimiter = rateLimiter;
        this.threatDetector = threatDetector;
        this.csrfGuard = csrfGuard;
        this.monitor = monitor;
        this.jwtService = jwtService;
        this.config = properties.getPipeline();
        this.threatConfig = properties.getThreat();
    }

    public Mono<PipelineDecision> evaluate(RequestContext request) {
        ClientIdentity client = identityResolver.resolve(request);
        Duration timeout = config.getTimeout();
        return Mono.defer(() -> runStages(request, client))
                .timeout(timeout)
                .onErrorResume(error -> Mono.just(failOpen(request, client, error)));
    }

    public boolean isBypassed(String path) {
        return matchesAny(config.getBypassPaths(), path);
    }

    public boolean isLoginPath(String path) {
        return matchesAny(config.getLoginPaths(), path);
    }

    private Mono<PipelineDecision> runStages(RequestContext request, ClientIdentity client) {
        if (isBypassed(request.getPath())) {
            return Mono.just(admit(request, client, PipelineStage.BYPASS_CHECK, null, null));
        }
        String userId = jwtService.extractSubject(JwtService.extractAuthorizationHeader(request.getHeaders()));

        return checkRateLimit(request, client)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .map(rate -> {
                    RateLimitResult rateLimit = rate.orElse(null);
                    if (rateLimit != null && !rateLimit.isAllowed()) {
                        return rejectRateLimited(request, client, userId, rateLimit);
                    }

                    ThreatScanResult threat = scanThreats(request);
                    if (threat.suspicious()) {
                        recordThreat(request, client, userId, threat);
                        if (threat.severity().isAtLeast(threatConfig.getBlockSeverity())) {
                            return reject(request, client, PipelineStage.THREAT_SCAN, rateLimit, threat,
                                    SecurityFailure.builder()
                                            .kind(ErrorKind.AUTHORIZATION)
                                            .publicMessage(THREAT_BLOCKED_MESSAGE)
                                            .internalDetail("Matched " + threat.matchedPatterns())
                                            .build());
                        }
                    }

                    if (configService.isEnabled(ConfigurationService.CSRF_ENABLED)) {
                        CsrfVerification csrf = csrfGuard.verify(request);
                        if (!csrf.valid()) {
                            monitor.logEvent(event(SecurityEventType.CSRF_VALIDATION_FAILED, request, client, userId)
                                    .detail("error", csrf.error())
                                    .detail("mode", csrfGuard.mode().name().toLowerCase())
                                    .build());
                            return reject(request, client, PipelineStage.CSRF_CHECK, rateLimit, threat,
                                    SecurityFailure.builder()
                                            .kind(ErrorKind.CSRF)
                                            .internalDetail(csrf.error())
                                            .build());
                        }
                    }
                    return admit(request, client, PipelineStage.ADMITTED, rateLimit, threat);
                });
    }

    private Mono<RateLimitResult> checkRateLimit(RequestContext request, ClientIdentity client) {
        if (!configService.isEnabled(ConfigurationService.RATE_LIMIT_ENABLED)) {
            return Mono.empty();
        }
        Optional<RateLimitTier> tier = rateLimiter.resolveTier(request.getPath());
        if (tier.isEmpty()) {
            return Mono.empty();
        }
        return rateLimiter.check(client.key(), tier.get().getName());
    }

    private ThreatScanResult scanThreats(RequestContext request) {
        if (!configService.isEnabled(ConfigurationService.THREAT_DETECTION_ENABLED)) {
            return ThreatScanResult.clean();
        }
        return threatDetector.scan(request);
    }

    private PipelineDecision rejectRateLimited(RequestContext request, ClientIdentity client, String userId,
                                               RateLimitResult rateLimit) {
        monitor.logEvent(event(SecurityEventType.RATE_LIMIT_EXCEEDED, request, client, userId)
                .detail("tier", rateLimit.getTier())
                .detail("limit", rateLimit.getLimit())
                .build());
        return reject(request, client, PipelineStage.RATE_LIMIT, rateLimit, null,
                SecurityFailure.builder()
                        .kind(ErrorKind.RATE_LIMIT)
                        .rateLimit(rateLimit)
                        .internalDetail("Tier " + rateLimit.getTier() + " exhausted for " + client.key())
                        .build());
    }

    private void recordThreat(RequestContext request, ClientIdentity client, String userId, ThreatScanResult threat) {
        List<String> categories = threat.categories().stream().map(ThreatCategory::wireName).sorted().toList();
        monitor.logEvent(event(SecurityEventType.SUSPICIOUS_ACTIVITY, request, client, userId)
                .severity(threat.severity())
                .detail("patterns", threat.matchedPatterns())
                .detail("categories", categories)
                .build());
    }

    private PipelineDecision failOpen(RequestContext request, ClientIdentity client, Throwable error) {
        log.error("Defense pipeline failed for request {} {} {}, admitting",
                request.getRequestId(), request.getMethod(), request.getPath(), error);
        try {
            monitor.logEvent(event(SecurityEventType.PIPELINE_ERROR, request, client, null)
                    .detail("kind", ErrorKind.UNEXPECTED.getCode())
                    .detail("error", error.toString())
                    .build());
        } catch (RuntimeException e) {
            log.error("Could not record pipeline error for request {}", request.getRequestId(), e);
        }
        return PipelineDecision.builder()
                .requestId(request.getRequestId())
                .admitted(true)
                .decidedAt(PipelineStage.ENTRY)
                .client(client)
                .failedOpen(true)
                .build();
    }

    private SecurityEvent.SecurityEventBuilder event(SecurityEventType type, RequestContext request,
                                                     ClientIdentity client, String userId) {
        return SecurityEvent.of(type)
                .sourceIp(client.ip())
                .userAgent(request.getHeaders().getFirst(HttpHeaders.USER_AGENT))
                .userId(userId)
                .detail("path", request.getPath())
                .detail("method", String.valueOf(request.getMethod()))
                .detail("requestId", request.getRequestId());
    }

    private static PipelineDecision admit(RequestContext request, ClientIdentity client, PipelineStage stage,
                                          RateLimitResult rateLimit, ThreatScanResult threat) {
        return PipelineDecision.builder()
                .requestId(request.getRequestId())
                .admitted(true)
                .decidedAt(stage)
                .client(client)
                .rateLimit(rateLimit)
                .threat(threat)
                .build();
    }

    private static PipelineDecision reject(RequestContext request, ClientIdentity client, PipelineStage stage,
                                           RateLimitResult rateLimit, ThreatScanResult threat,
                                           SecurityFailure failure) {
        return PipelineDecision.builder()
                .requestId(request.getRequestId())
                .admitted(false)
                .decidedAt(stage)
                .client(client)
                .rateLimit(rateLimit)
                .threat(threat)
                .failure(failure)
                .build();
    }

    private boolean matchesAny(List<String> patterns, String path) {
        return path != null && patterns.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }
}
