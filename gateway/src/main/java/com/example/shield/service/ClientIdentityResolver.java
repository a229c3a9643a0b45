package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.RequestContext;
import com.example.shield.model.ClientIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;

/**
 * Derives the client address from proxy headers when they are trusted,
 * falling back to the socket peer.
 */
@Service
@RequiredArgsConstructor
public class ClientIdentityResolver {

    static final String UNKNOWN = "unknown";

    private final ShieldProperties properties;

    public ClientIdentity resolve(RequestContext request) {
        return new ClientIdentity(resolveIp(request.getHeaders(), request.getRemoteAddress()), request.userAgent());
    }

    public String resolveIp(HttpHeaders headers, InetSocketAddress remoteAddress) {
        if (properties.getPipeline().isTrustForwardedHeaders()) {
            String ip = firstNonBlank(headers.getFirst("CF-Connecting-IP"), headers.getFirst("X-Real-IP"));
            if (ip != null) {
                return ip;
            }
            String forwarded = headers.getFirst("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return UNKNOWN;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
