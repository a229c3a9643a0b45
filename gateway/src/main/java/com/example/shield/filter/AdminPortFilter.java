package com.example.shield.filter;

import com.example.shield.config.ShieldProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;

/**
 * Hides the admin API on every port except the admin port. Requests for the
 * admin prefix arriving elsewhere get a bare 404, as if the route did not
 * exist.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminPortFilter implements WebFilter, Ordered {

    private final ShieldProperties properties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (path.startsWith(properties.getAdmin().getPathPrefix()) && !arrivedOnAdminPort(exchange)) {
            log.debug("Rejecting admin API request outside the admin port: {}", path);
            exchange.getResponse().setStatusCode(HttpStatus.NOT_FOUND);
            return exchange.getResponse().setComplete();
        }
        return chain.filter(exchange);
    }

    private boolean arrivedOnAdminPort(ServerWebExchange exchange) {
        InetSocketAddress local = exchange.getRequest().getLocalAddress();
        return local != null && local.getPort() == properties.getAdmin().getPort();
    }

    @Override
    public int getOrder() {
        return HIGHEST_PRECEDENCE;
    }
}
