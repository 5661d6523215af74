package com.example.guard.alert;

/**
 * Receives every published alert. Implementations run on the publishing thread
 * and must not publish alerts themselves.
 */
@FunctionalInterface
public interface AlertSubscriber {

    void onAlert(SecurityAlert alert);

    default String name() {
        return getClass().getSimpleName();
    }
}
