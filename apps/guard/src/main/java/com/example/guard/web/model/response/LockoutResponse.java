package com.example.guard.web.model.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LockoutResponse(String identifier, String endpoint, boolean locked, Instant lockedUntil) {}
