package com.example.guard.web.model.response;

/**
 * Acknowledges an admin operation; {@code changed} is false when there was nothing to do.
 */
public record OperationResponse(String operation, String target, boolean changed) {}
