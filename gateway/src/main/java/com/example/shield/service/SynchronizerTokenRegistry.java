package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.CsrfVerification;
import com.example.shield.dto.RequestContext;
import com.example.shield.util.SignatureCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Server-side session to token map for the synchronizer pattern. The map is
 * bounded; issuing beyond capacity evicts the oldest session.
 */
@Service
@Slf4j
public class SynchronizerTokenRegistry {

    private final CsrfTokenService tokenService;
    private final int capacity;
    private final String sessionCookieName;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, String> sessionTokens = new LinkedHashMap<>();

    public SynchronizerTokenRegistry(CsrfTokenService tokenService, ShieldProperties properties) {
        this.tokenService = tokenService;
        this.capacity = properties.getCsrf().getSynchronizerCapacity();
        this.sessionCookieName = properties.getCsrf().getSessionCookieName();
    }

    public String issue(String sessionId) {
        String token = tokenService.generateToken();
        lock.lock();
        try {
            // re-insert so a reissued session counts as newest
            sessionTokens.remove(sessionId);
            sessionTokens.put(sessionId, token);
            Iterator<String> oldest = sessionTokens.keySet().iterator();
            while (sessionTokens.size() > capacity && oldest.hasNext()) {
                String evicted = oldest.next();
                oldest.remove();
                log.debug("Synchronizer registry full, evicted session {}", evicted);
            }
        } finally {
            lock.unlock();
        }
        return token;
    }

    public boolean verify(String sessionId, String submittedToken) {
        if (sessionId == null || submittedToken == null) {
            return false;
        }
        String stored;
        lock.lock();
        try {
            stored = sessionTokens.get(sessionId);
        } finally {
            lock.unlock();
        }
        return stored != null
                && SignatureCodec.constantTimeEquals(stored, submittedToken)
                && tokenService.validateToken(stored);
    }

    public CsrfVerification verifyRequest(RequestContext request) {
        if (!tokenService.requiresProtection(request)) {
            return CsrfVerification.ok();
        }
        String sessionId = request.cookie(sessionCookieName);
        if (sessionId == null || sessionId.isBlank()) {
            return CsrfVerification.rejected("Session missing");
        }
        String submitted = request.header(tokenService.getConfig().getHeaderName());
        if (submitted == null || submitted.isBlank()) {
            return CsrfVerification.rejected(CsrfTokenService.MISSING);
        }
        if (!verify(sessionId, submitted)) {
            return CsrfVerification.rejected("CSRF token does not match session");
        }
        return CsrfVerification.ok();
    }

    public void invalidate(String sessionId) {
        lock.lock();
        try {
            sessionTokens.remove(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops sessions whose token has expired, examining at most
     * {@code batchSize} entries per lock acquisition. Entries sit in issue
     * order, so the first live token ends the sweep.
     */
    public int sweepExpired(int batchSize) {
        int batch = Math.max(1, batchSize);
        int removed = 0;
        boolean more = true;
        while (more) {
            int examined = 0;
            lock.lock();
            try {
                Iterator<Map.Entry<String, String>> it = sessionTokens.entrySet().iterator();
                while (examined < batch && it.hasNext()) {
                    examined++;
                    if (!tokenService.isExpired(it.next().getValue())) {
                        more = false;
                        break;
                    }
                    it.remove();
                    removed++;
                }
                more = more && examined == batch;
            } finally {
                lock.unlock();
            }
        }
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return sessionTokens.size();
        } finally {
            lock.unlock();
        }
    }
}
