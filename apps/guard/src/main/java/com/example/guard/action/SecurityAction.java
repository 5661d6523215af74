package com.example.guard.action;

import java.time.Instant;

/**
 * An executed (or attempted) remediation step with its outcome.
 */
public record SecurityAction(
        ActionType type,
        Instant timestamp,
        String description,
        boolean automated,
        ActionResult result
) {
}
