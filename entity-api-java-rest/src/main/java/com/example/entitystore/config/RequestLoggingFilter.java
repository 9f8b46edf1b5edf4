package com.example.entitystore.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

@Component
@Slf4j
public class RequestLoggingFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long t0 = System.currentTimeMillis();
        return chain.filter(exchange)
                .doFinally(signal -> {
                    long ms = System.currentTimeMillis() - t0;
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    log.info("{} {} -> {} ({}ms)",
                            exchange.getRequest().getMethod(),
                            exchange.getRequest().getPath().value(),
                            status != null ? status.value() : "-",
                            ms);
                });
    }
}
