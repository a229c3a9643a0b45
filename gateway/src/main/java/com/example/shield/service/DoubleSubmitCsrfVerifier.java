package com.example.shield.service;

import com.example.shield.dto.CsrfVerification;
import com.example.shield.dto.RequestContext;
import com.example.shield.util.SignatureCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Double-submit check: the cookie copy and the header copy must both be
 * valid signed tokens and identical.
 */
@Service
@RequiredArgsConstructor
public class DoubleSubmitCsrfVerifier {

    private final CsrfTokenService tokenService;

    public CsrfVerification verify(String cookieToken, String submittedToken) {
        if (isBlank(cookieToken) || isBlank(submittedToken)) {
            return CsrfVerification.rejected("CSRF tokens missing");
        }
        boolean cookieValid = tokenService.validateToken(cookieToken);
        boolean submittedValid = tokenService.validateToken(submittedToken);
        if (!(cookieValid & submittedValid)) {
            return CsrfVerification.rejected("CSRF tokens invalid");
        }
        if (!SignatureCodec.constantTimeEquals(cookieToken, submittedToken)) {
            return CsrfVerification.rejected("CSRF tokens do not match");
        }
        return CsrfVerification.ok();
    }

    public CsrfVerification verifyRequest(RequestContext request) {
        if (!tokenService.requiresProtection(request)) {
            return CsrfVerification.ok();
        }
        return verify(request.cookie(tokenService.getConfig().getCookieName()),
                request.header(tokenService.getConfig().getHeaderName()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
