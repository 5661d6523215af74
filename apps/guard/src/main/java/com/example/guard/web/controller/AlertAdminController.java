package com.example.guard.web.controller;

import com.example.guard.alert.SecurityAlert;
import com.example.guard.engine.ProtectionEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/protection/alerts")
@RequiredArgsConstructor
public class AlertAdminController {

    private static final int MAX_WINDOW_MINUTES = 1440;

    private final ProtectionEngine engine;

    /**
     * Retained alerts, optionally limited to the last {@code windowMinutes}.
     */
    @GetMapping
    public Mono<List<SecurityAlert>> list(@RequestParam(required = false) Integer windowMinutes) {
        if (windowMinutes != null && (windowMinutes < 1 || windowMinutes > MAX_WINDOW_MINUTES)) {
            return Mono.error(new IllegalArgumentException(
                    "windowMinutes must be between 1 and " + MAX_WINDOW_MINUTES));
        }
        return Mono.fromSupplier(() -> engine.alerts(windowMinutes == null ? null : Duration.ofMinutes(windowMinutes)));
    }

    /**
     * Live alert feed. Slow consumers miss alerts rather than holding up the engine.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SecurityAlert>> stream() {
        return engine.alertStream()
                .map(alert -> ServerSentEvent.<SecurityAlert>builder()
                        .event(alert.type().value())
                        .data(alert)
                        .build());
    }
}
