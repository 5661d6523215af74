package com.example.guard.action;

import java.util.Objects;

/**
 * An action bound to a policy or incident response, not yet executed.
 */
public record ActionTemplate(ActionType type, String description) {

    public ActionTemplate {
        Objects.requireNonNull(type, "type");
        description = description == null ? type.value() : description;
    }

    public static ActionTemplate of(ActionType type, String description) {
        return new ActionTemplate(type, description);
    }
}
