package com.example.guard.action;

import com.example.guard.alert.Severity;
import org.springframework.lang.Nullable;

/**
 * Target of an action.
 *
 * @param reference incident id or policy name the action is executed for
 */
public record ActionContext(
        String identifier,
        Severity severity,
        @Nullable String reference,
        String summary
) {
}
