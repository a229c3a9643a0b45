package com.example.shield.controller;

import com.example.shield.config.ShieldProperties;
import com.example.shield.exception.ShieldException;
import com.example.shield.model.CsrfMode;
import com.example.shield.model.ErrorKind;
import com.example.shield.service.CsrfGuard;
import com.example.shield.service.CsrfTokenService;
import com.example.shield.service.SynchronizerTokenRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpCookie;
import org.springframework.http.ResponseCookie;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/shield")
@RequiredArgsConstructor
public class CsrfTokenController {

    private final CsrfTokenService tokenService;
    private final SynchronizerTokenRegistry synchronizerRegistry;
    private final CsrfGuard csrfGuard;

    /**
     * Issues a CSRF token as a cookie and in the body. Clients echo it back in
     * the CSRF header on unsafe requests.
     */
    @GetMapping("/csrf-token")
    public Mono<Map<String, Object>> issueToken(ServerWebExchange exchange) {
        return Mono.fromCallable(() -> {
            ShieldProperties.Csrf config = tokenService.getConfig();
            String token;
            if (csrfGuard.mode() == CsrfMode.SYNCHRONIZER) {
                HttpCookie session = exchange.getRequest().getCookies().getFirst(config.getSessionCookieName());
                if (session == null || session.getValue().isBlank()) {
                    throw new ShieldException(ErrorKind.AUTH, "Session required");
                }
                token = synchronizerRegistry.issue(session.getValue());
            } else {
                token = tokenService.generateToken();
            }

            exchange.getResponse().addCookie(ResponseCookie.from(config.getCookieName(), token)
                    .maxAge(config.getMaxAge())
                    .path("/")
                    .sameSite(config.getSameSite())
                    .secure(config.isSecureCookie())
                    .httpOnly(true)
                    .build());

            return Map.of(
                    "token", token,
                    "headerName", config.getHeaderName(),
                    "expiresIn", config.getMaxAge().toSeconds());
        });
    }
}
