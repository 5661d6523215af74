package com.example.guard.incident;

import com.example.guard.action.SecurityAction;
import com.example.guard.alert.Severity;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tracked incident. Descriptive fields are fixed at creation; status, actions and
 * metadata change under the incident's monitor.
 */
public class SecurityIncident {

    @Getter
    private final String id;
    @Getter
    private final IncidentType type;
    @Getter
    private final Severity severity;
    @Getter
    private final String title;
    @Getter
    private final String description;
    @Getter
    private final Instant timestamp;
    @Getter
    private final String source;
    @Getter
    private final String identifier;

    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final List<SecurityAction> actions = new ArrayList<>();
    private IncidentStatus status = IncidentStatus.OPEN;
    private String resolution;
    private Instant resolvedAt;

    public SecurityIncident(String id, IncidentType type, Severity severity, String title, String description,
                            Instant timestamp, String source, String identifier, Map<String, Object> metadata) {
        this.id = id;
        this.type = type;
        this.severity = severity;
        this.title = title;
        this.description = description;
        this.timestamp = timestamp;
        this.source = source;
        this.identifier = identifier;
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
    }

    public synchronized IncidentStatus status() {
        return status;
    }

    /**
     * Moves to {@code target} if the lifecycle allows it.
     *
     * @return the previous status, or null when the transition was rejected
     */
    @Nullable
    synchronized IncidentStatus transitionTo(IncidentStatus target, Instant at, @Nullable String note) {
        if (!status.canTransitionTo(target)) {
            return null;
        }
        IncidentStatus previous = status;
        status = target;
        if (target.isTerminal()) {
            resolution = note;
            resolvedAt = at;
        }
        return previous;
    }

    synchronized void addActions(List<SecurityAction> executed) {
        actions.addAll(executed);
    }

    synchronized void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public synchronized List<SecurityAction> actions() {
        return List.copyOf(actions);
    }

    public synchronized IncidentView view() {
        return new IncidentView(id, type, severity, title, description, timestamp, source, identifier,
                new LinkedHashMap<>(metadata), status, List.copyOf(actions), resolution, resolvedAt);
    }
}
