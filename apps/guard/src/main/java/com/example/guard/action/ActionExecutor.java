package com.example.guard.action;

import com.example.guard.captcha.CaptchaService;
import com.example.guard.captcha.CaptchaType;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.observability.audit.SecurityAuditLogger;
import com.example.guard.progression.BlockRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Executes policy and incident actions. A failing action is recorded as
 * {@link ActionResult#FAILED}; it never propagates to the caller.
 *
 * <p>The alert action notifies operators only; it does not publish onto the alert bus.
 */
@Slf4j
public class ActionExecutor {

    private final BlockRegistry blocks;
    private final CaptchaService captcha;
    private final SecurityNotifier notifier;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;
    private final Duration blockDuration;

    public ActionExecutor(BlockRegistry blocks, CaptchaService captcha, SecurityNotifier notifier,
                          SecurityAuditLogger auditLogger, Clock clock, Duration blockDuration) {
        this.blocks = blocks;
        this.captcha = captcha;
        this.notifier = notifier;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.blockDuration = blockDuration;
    }

    public SecurityAction execute(ActionContext context, ActionTemplate template) {
        Instant now = clock.instant();
        ActionResult result;
        try {
            switch (template.type()) {
                case BLOCK -> blocks.block(context.identifier(), now.plus(blockDuration));
                case CAPTCHA -> captcha.issueChallenge(context.identifier(), CaptchaType.RECAPTCHA);
                case ALERT -> notifier.notify(context, context.summary());
                case ESCALATE -> notifier.escalate(context, context.summary());
                case LOG -> auditLogger.logActionRequested(context, template);
            }
            result = ActionResult.SUCCESS;
        } catch (RuntimeException e) {
            log.error("Action {} failed for {}: {}", template.type().value(),
                    StringSanitizer.forLog(context.identifier()), e.getMessage(), e);
            result = ActionResult.FAILED;
        }
        SecurityAction action = new SecurityAction(template.type(), now, template.description(), true, result);
        auditLogger.logActionExecuted(context, action);
        return action;
    }

    public Duration blockDuration() {
        return blockDuration;
    }
}
