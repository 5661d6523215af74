package com.example.guard.action;

import com.example.guard.common.util.StringSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier that writes to the {@code SECURITY_NOTIFY} logger for forwarding
 * by the log pipeline.
 */
public class LoggingSecurityNotifier implements SecurityNotifier {

    private static final Logger NOTIFY_LOG = LoggerFactory.getLogger("SECURITY_NOTIFY");

    @Override
    public void notify(ActionContext context, String message) {
        NOTIFY_LOG.warn("[{}] {} for {}: {}", context.severity().value(),
                context.reference() != null ? context.reference() : "-",
                StringSanitizer.forLog(context.identifier()), StringSanitizer.forLog(message, 200));
    }

    @Override
    public void escalate(ActionContext context, String message) {
        NOTIFY_LOG.error("ESCALATION [{}] {} for {}: {}", context.severity().value(),
                context.reference() != null ? context.reference() : "-",
                StringSanitizer.forLog(context.identifier()), StringSanitizer.forLog(message, 200));
    }
}
