package com.example.guard.observability.filter;

import com.example.guard.common.util.ClientIpExtractor;
import com.example.guard.common.util.StringSanitizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Logs API calls with their latency and records them on the {@code guard.http.requests}
 * timer. Runs after {@link CorrelationIdFilter}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class RequestLoggingFilter implements WebFilter {

    static final String CLIENT_IP_KEY = "clientIp";

    private static final Pattern INCIDENT_ID = Pattern.compile("/SEC-[A-Z0-9]+-[A-Z0-9]+");
    private static final Pattern PATH_SEGMENT_AFTER_RESOURCE = Pattern.compile(
            "(/(?:lockouts|blocks|resets|configs|rules|policies))/[^/]+");

    private final MeterRegistry meterRegistry;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (path.startsWith("/actuator")) {
            return chain.filter(exchange);
        }

        long startNanos = System.nanoTime();
        String method = exchange.getRequest().getMethod().name();
        String clientIp = ClientIpExtractor.extract(exchange);
        String sanitizedPath = StringSanitizer.forLog(path, 128);

        return chain.filter(exchange)
                .doFirst(() -> {
                    MDC.put(CLIENT_IP_KEY, StringSanitizer.forLog(clientIp));
                    log.debug("Incoming request: {} {}", method, sanitizedPath);
                })
                .doFinally(signalType -> {
                    long elapsedNanos = System.nanoTime() - startNanos;
                    HttpStatusCode statusCode = exchange.getResponse().getStatusCode();
                    int status = statusCode != null ? statusCode.value() : 200;

                    Timer.builder("guard.http.requests")
                            .tag("method", method)
                            .tag("uri", normalizePath(path))
                            .tag("status", String.valueOf(status))
                            .register(meterRegistry)
                            .record(elapsedNanos, TimeUnit.NANOSECONDS);

                    long elapsedMs = elapsedNanos / 1_000_000;
                    if (status >= 500) {
                        log.error("Request completed: {} {} - {} in {}ms", method, sanitizedPath, status, elapsedMs);
                    } else if (status >= 400) {
                        log.warn("Request completed: {} {} - {} in {}ms", method, sanitizedPath, status, elapsedMs);
                    } else {
                        log.info("Request completed: {} {} - {} in {}ms", method, sanitizedPath, status, elapsedMs);
                    }
                    MDC.remove(CLIENT_IP_KEY);
                });
    }

    /**
     * Collapses incident ids and admin path parameters so the uri tag stays bounded.
     */
    static String normalizePath(String path) {
        String normalized = INCIDENT_ID.matcher(path).replaceAll("/incident-id");
        normalized = PATH_SEGMENT_AFTER_RESOURCE.matcher(normalized).replaceAll("$1/id");
        return StringSanitizer.forTag(normalized);
    }
}
