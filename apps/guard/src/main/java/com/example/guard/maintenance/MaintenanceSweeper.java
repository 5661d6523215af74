package com.example.guard.maintenance;

import com.example.guard.alert.AlertLog;
import com.example.guard.captcha.CaptchaService;
import com.example.guard.detection.AlertThrottle;
import com.example.guard.event.SecurityEventStore;
import com.example.guard.incident.IncidentManager;
import com.example.guard.ledger.AttemptLedger;
import com.example.guard.progression.BlockRegistry;
import com.example.guard.progression.LockoutRegistry;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reclaims expired state and ages out history. Steps are independent: a failing
 * step is logged and the remaining steps still run.
 *
 * <p>Correctness never depends on the sweeper; every expiry is also checked on read.
 */
@Slf4j
@Builder
public class MaintenanceSweeper {

    private final Clock clock;
    private final AttemptLedger abuseLedger;
    private final AttemptLedger rateLedger;
    private final LockoutRegistry lockouts;
    private final BlockRegistry blocks;
    private final CaptchaService captcha;
    private final AlertLog alertLog;
    private final SecurityEventStore events;
    private final AlertThrottle throttle;
    private final IncidentManager incidents;
    private final Duration historyHorizon;
    private final Duration incidentAutoResolveAfter;
    private final Duration incidentRetention;

    public SweepReport sweep() {
        Instant now = clock.instant();
        Instant historyCutoff = now.minus(historyHorizon);

        Map<String, Function<Instant, Integer>> steps = new LinkedHashMap<>();
        steps.put("lockouts", lockouts::purgeExpired);
        steps.put("windowFloors", at -> lockouts.purgeFloorsOlderThan(historyCutoff));
        steps.put("blocks", blocks::purgeExpired);
        steps.put("captchas", captcha::purgeExpired);
        steps.put("abuseLedger", at -> abuseLedger.purgeOlderThan(historyCutoff));
        steps.put("rateLedger", at -> rateLedger.purgeOlderThan(historyCutoff));
        steps.put("alerts", at -> alertLog.purgeOlderThan(historyCutoff));
        steps.put("events", at -> events.purgeOlderThan(historyCutoff));
        steps.put("throttle", throttle::purgeExpired);
        steps.put("autoResolvedIncidents", at -> incidents.autoResolveOpenedBefore(at.minus(incidentAutoResolveAfter)));
        steps.put("closedIncidents", at -> incidents.purgeClosedBefore(at.minus(incidentRetention)));

        Map<String, Integer> removed = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        steps.forEach((name, step) -> {
            try {
                removed.put(name, step.apply(now));
            } catch (RuntimeException e) {
                log.error("Maintenance step {} failed: {}", name, e.getMessage(), e);
                failed.add(name);
            }
        });

        SweepReport report = new SweepReport(removed, failed);
        log.debug("Maintenance sweep removed {} entries ({})", report.total(), removed);
        return report;
    }
}
