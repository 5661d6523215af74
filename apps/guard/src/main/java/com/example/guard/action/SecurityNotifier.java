package com.example.guard.action;

/**
 * Outbound channel for alert and escalate actions (paging, chat, ticketing).
 */
public interface SecurityNotifier {

    void notify(ActionContext context, String message);

    void escalate(ActionContext context, String message);
}
