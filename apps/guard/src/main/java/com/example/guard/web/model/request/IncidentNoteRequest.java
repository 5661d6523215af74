package com.example.guard.web.model.request;

import jakarta.validation.constraints.Size;

public record IncidentNoteRequest(
        @Size(max = 1024, message = "Note must not exceed 1024 characters")
        String note
) {}
