package com.example.guard.observability.audit;

import com.example.guard.action.ActionContext;
import com.example.guard.action.ActionResult;
import com.example.guard.action.ActionTemplate;
import com.example.guard.action.SecurityAction;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.observability.audit.SecurityAuditEvent.Outcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes security audit records as single-line JSON on the {@code SECURITY_AUDIT}
 * logger for SIEM ingestion.
 */
public class SecurityAuditLogger {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("SECURITY_AUDIT");

    private final ObjectMapper objectMapper;

    public SecurityAuditLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void logAlert(@NonNull SecurityAlert alert) {
        Outcome outcome = alert.severity().isAtLeast(Severity.HIGH) ? Outcome.BLOCKED : Outcome.SUCCESS;
        logEvent(SecurityAuditEvent.of(SecurityAuditEvent.EventType.ALERT_RAISED, outcome,
                alert.severity().value(), alert.identifier(), alert.endpoint(), alert.type().value(),
                alert.description(), alert.metadata()));
    }

    public void logIncidentOpened(@NonNull String incidentId, @NonNull String type, @NonNull Severity severity,
                                  @Nullable String identifier, @NonNull String title) {
        logEvent(SecurityAuditEvent.of(SecurityAuditEvent.EventType.INCIDENT_OPENED, Outcome.SUCCESS,
                severity.value(), identifier, null, incidentId, title, Map.of("incidentType", type)));
    }

    public void logIncidentStatusChanged(@NonNull String incidentId, @NonNull String from, @NonNull String to,
                                         @Nullable String note) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", from);
        details.put("to", to);
        if (note != null) {
            details.put("note", note);
        }
        logEvent(SecurityAuditEvent.of(SecurityAuditEvent.EventType.INCIDENT_STATUS_CHANGED, Outcome.SUCCESS,
                null, null, null, incidentId, null, details));
    }

    public void logActionRequested(@NonNull ActionContext context, @NonNull ActionTemplate template) {
        logEvent(SecurityAuditEvent.of(SecurityAuditEvent.EventType.ACTION_REQUESTED, Outcome.SUCCESS,
                context.severity().value(), context.identifier(), null, context.reference(),
                template.description(), Map.of("summary", context.summary())));
    }

    public void logActionExecuted(@NonNull ActionContext context, @NonNull SecurityAction action) {
        Outcome outcome = action.result() == ActionResult.FAILED ? Outcome.FAILURE : Outcome.SUCCESS;
        logEvent(SecurityAuditEvent.of(SecurityAuditEvent.EventType.ACTION_EXECUTED, outcome,
                context.severity().value(), context.identifier(), null, context.reference(),
                action.description(), Map.of("actionType", action.type().value(), "result", action.result().value())));
    }

    public void logAdminOperation(@NonNull String operation, @Nullable String target, @Nullable Map<String, Object> details) {
        logEvent(SecurityAuditEvent.of(SecurityAuditEvent.EventType.ADMIN_OPERATION, Outcome.SUCCESS,
                null, target, null, operation, null, details));
    }

    private void logEvent(@NonNull SecurityAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize security audit event: {}", e.getMessage());
            logFallback(event);
        }
    }

    private void logByOutcome(@NonNull Outcome outcome, String json) {
        switch (outcome) {
            case SUCCESS -> AUDIT_LOG.info(json);
            case FAILURE, BLOCKED -> AUDIT_LOG.warn(json);
        }
    }

    private void logFallback(@NonNull SecurityAuditEvent event) {
        AUDIT_LOG.warn("Security {} - outcome={}, identifier={}, reference={}",
                event.eventType(), event.outcome(),
                StringSanitizer.forLog(event.identifier()),
                StringSanitizer.forLog(event.reference()));
    }
}
