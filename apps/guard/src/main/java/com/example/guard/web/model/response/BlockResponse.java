package com.example.guard.web.model.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockResponse(String identifier, boolean blocked, Instant blockedUntil) {}
