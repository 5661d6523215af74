package com.example.guard.observability.filter;

import com.example.guard.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Tags every request with a correlation id so a decision, the alerts it raised and
 * the audit records they produced can be joined in the logs.
 *
 * <p>Caller-supplied ids are only reused when they are safe identifiers; anything
 * else is replaced with a fresh UUID.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String REQUEST_PATH_KEY = "requestPath";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String correlationId = resolveCorrelationId(request);
        String requestPath = request.getPath().value();

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId, REQUEST_PATH_KEY, requestPath))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    MDC.put(REQUEST_PATH_KEY, StringSanitizer.forLog(requestPath, 128));
                })
                .doFinally(signalType -> {
                    MDC.remove(CORRELATION_ID_KEY);
                    MDC.remove(REQUEST_PATH_KEY);
                });
    }

    static String resolveCorrelationId(ServerHttpRequest request) {
        for (String header : new String[]{CORRELATION_ID_HEADER, REQUEST_ID_HEADER}) {
            String candidate = StringSanitizer.trimToNull(request.getHeaders().getFirst(header));
            if (candidate != null && StringSanitizer.isValidIdentifier(candidate)) {
                return candidate;
            }
            if (candidate != null) {
                log.debug("Ignoring malformed {} header", header);
            }
        }
        return UUID.randomUUID().toString();
    }

    public static Mono<String> currentCorrelationId() {
        return Mono.deferContextual(ctx -> Mono.just(ctx.getOrDefault(CORRELATION_ID_KEY, "unknown")));
    }
}
