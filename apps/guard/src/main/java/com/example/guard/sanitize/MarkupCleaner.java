package com.example.guard.sanitize;

/**
 * Rewrites markup into a safe subset.
 */
@FunctionalInterface
public interface MarkupCleaner {

    String clean(String markup);
}
