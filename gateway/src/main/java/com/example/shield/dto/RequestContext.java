package com.example.shield.dto;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.reactive.ServerHttpRequest;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The parts of an inbound request the defense pipeline looks at.
 */
@Value
@Builder
public class RequestContext {
    String requestId;
    HttpMethod method;
    String path;
    String rawQuery;
    @Builder.Default
    HttpHeaders headers = new HttpHeaders();
    @Builder.Default
    Map<String, String> cookies = Map.of();
    InetSocketAddress remoteAddress;
    byte[] body;

    public String header(String name) {
        return headers.getFirst(name);
    }

    public String cookie(String name) {
        return cookies.get(name);
    }

    public String userAgent() {
        return headers.getFirst(HttpHeaders.USER_AGENT);
    }

    public static RequestContext from(ServerHttpRequest request, byte[] body, String requestId) {
        Map<String, String> cookies = new HashMap<>();
        for (Map.Entry<String, List<HttpCookie>> entry : request.getCookies().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                cookies.put(entry.getKey(), entry.getValue().get(0).getValue());
            }
        }
        return RequestContext.builder()
                .requestId(requestId)
                .method(request.getMethod())
                .path(request.getURI().getRawPath())
                .rawQuery(request.getURI().getRawQuery())
                .headers(request.getHeaders())
                .cookies(cookies)
                .remoteAddress(request.getRemoteAddress())
                .body(body)
                .build();
    }
}
