package com.example.shield.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.web.server.adapter.WebHttpHandlerBuilder;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

/**
 * Second HTTP server for the admin API, bound to the admin host (localhost
 * by default). It shares the application's handlers and web filters;
 * {@code AdminPortFilter} answers admin paths with 404 on any other port.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "shield.admin", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AdminServerConfig {

    @Bean(destroyMethod = "disposeNow")
    public DisposableServer adminHttpServer(ApplicationContext applicationContext, ShieldProperties properties) {
        ShieldProperties.Admin admin = properties.getAdmin();
        log.info("Starting admin server on {}:{}", admin.getHost(), admin.getPort());

        HttpHandler httpHandler = WebHttpHandlerBuilder
                .applicationContext(applicationContext)
                .build();

        return HttpServer.create()
                .host(admin.getHost())
                .port(admin.getPort())
                .handle(new ReactorHttpHandlerAdapter(httpHandler))
                .doOnBound(server -> log.info("Admin server bound to {}:{}", admin.getHost(), server.port()))
                .bindNow();
    }
}
