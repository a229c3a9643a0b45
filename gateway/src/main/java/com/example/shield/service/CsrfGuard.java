package com.example.shield.service;

import com.example.shield.dto.CsrfVerification;
import com.example.shield.dto.RequestContext;
import com.example.shield.model.CsrfMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Verifies a request with whichever CSRF scheme is configured.
 */
@Service
@RequiredArgsConstructor
public class CsrfGuard {

    private final CsrfTokenService tokenService;
    private final DoubleSubmitCsrfVerifier doubleSubmitVerifier;
    private final SynchronizerTokenRegistry synchronizerRegistry;

    public CsrfVerification verify(RequestContext request) {
        return switch (mode()) {
            case SIGNED -> tokenService.verifyRequest(request);
            case DOUBLE_SUBMIT -> doubleSubmitVerifier.verifyRequest(request);
            case SYNCHRONIZER -> synchronizerRegistry.verifyRequest(request);
        };
    }

    public CsrfMode mode() {
        return tokenService.getConfig().getMode();
    }
}
