package com.example.guard.alert;

import com.example.guard.common.util.StringSanitizer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process topic for security alerts.
 *
 * <p>Every alert is appended to the {@link AlertLog} and then multicast to all
 * current subscribers. Subscribers are isolated from each other: a subscriber
 * that throws is logged and keeps its subscription, and the publisher never
 * sees the failure.
 */
@Slf4j
public class AlertBus {

    private static final Duration EMIT_TIMEOUT = Duration.ofSeconds(2);

    private final Sinks.Many<SecurityAlert> sink = Sinks.many().multicast().directBestEffort();
    private final AlertLog alertLog;
    private final AtomicInteger subscriberCount = new AtomicInteger();

    public AlertBus(AlertLog alertLog) {
        this.alertLog = alertLog;
    }

    public void publish(SecurityAlert alert) {
        alertLog.append(alert);
        try {
            sink.emitNext(alert, Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT));
        } catch (Sinks.EmissionException e) {
            log.error("Failed to deliver {} alert for {}: {}",
                    alert.type().value(), StringSanitizer.forLog(alert.identifier()), e.getReason());
        }
    }

    /**
     * Registers a subscriber; dispose the returned handle to unsubscribe.
     */
    public Disposable subscribe(AlertSubscriber subscriber) {
        subscriberCount.incrementAndGet();
        return sink.asFlux()
                .doFinally(signal -> subscriberCount.decrementAndGet())
                .subscribe(alert -> deliver(subscriber, alert));
    }

    /**
     * Live alert stream for streaming consumers such as the admin event-stream endpoint.
     */
    public Flux<SecurityAlert> stream() {
        return sink.asFlux();
    }

    public AlertLog alertLog() {
        return alertLog;
    }

    public int subscriberCount() {
        return subscriberCount.get();
    }

    @PreDestroy
    public void close() {
        sink.tryEmitComplete();
        log.info("Alert bus closed");
    }

    private void deliver(AlertSubscriber subscriber, SecurityAlert alert) {
        try {
            subscriber.onAlert(alert);
        } catch (RuntimeException e) {
            log.warn("Alert subscriber {} failed on {} alert: {}",
                    subscriber.name(), alert.type().value(), e.getMessage(), e);
        }
    }
}
