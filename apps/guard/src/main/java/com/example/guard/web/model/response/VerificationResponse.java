package com.example.guard.web.model.response;

public record VerificationResponse(String identifier, boolean valid) {}
