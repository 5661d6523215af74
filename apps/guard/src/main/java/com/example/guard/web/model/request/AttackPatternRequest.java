package com.example.guard.web.model.request;

import com.example.guard.detection.AttackPattern;
import com.example.guard.detection.AttackType;
import com.example.guard.detection.PatternAction;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Duration;

public record AttackPatternRequest(
        @NotNull(message = "Attack type is required")
        AttackType type,

        @Min(value = 1, message = "Threshold must be at least 1")
        int threshold,

        @NotNull(message = "timeWindow is required")
        Duration timeWindow,

        @NotNull(message = "Action is required")
        PatternAction action,

        @Size(max = 256)
        String description
) {
    public AttackPattern toPattern() {
        return new AttackPattern(type, threshold, timeWindow, action, description);
    }
}
