package com.example.guard.web.controller;

import com.example.guard.common.exception.ResourceNotFoundException;
import com.example.guard.engine.ProtectionEngine;
import com.example.guard.incident.IncidentStatus;
import com.example.guard.incident.IncidentView;
import com.example.guard.web.model.request.IncidentNoteRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Predicate;

/**
 * Incident lifecycle. Unknown ids answer 404; a transition the current status does
 * not allow answers 409.
 */
@RestController
@RequestMapping("/api/v1/admin/protection/incidents")
@RequiredArgsConstructor
public class IncidentAdminController {

    private final ProtectionEngine engine;

    @GetMapping
    public Mono<List<IncidentView>> list(@RequestParam(required = false) String status) {
        return Mono.fromSupplier(() -> engine.incidents(status == null ? null : IncidentStatus.from(status)));
    }

    @GetMapping("/{id}")
    public Mono<IncidentView> find(@PathVariable String id) {
        return Mono.fromSupplier(() -> require(id));
    }

    @PostMapping("/{id}/resolve")
    public Mono<IncidentView> resolve(@PathVariable String id,
                                      @Valid @RequestBody(required = false) IncidentNoteRequest request) {
        return transition(id, IncidentStatus.RESOLVED,
                ignored -> engine.resolveIncident(id, noteOf(request)));
    }

    @PostMapping("/{id}/investigate")
    public Mono<IncidentView> investigate(@PathVariable String id) {
        return transition(id, IncidentStatus.INVESTIGATING, ignored -> engine.investigateIncident(id));
    }

    @PostMapping("/{id}/false-positive")
    public Mono<IncidentView> markFalsePositive(@PathVariable String id,
                                                @Valid @RequestBody(required = false) IncidentNoteRequest request) {
        return transition(id, IncidentStatus.FALSE_POSITIVE,
                ignored -> engine.markFalsePositive(id, noteOf(request)));
    }

    private Mono<IncidentView> transition(String id, IncidentStatus target, Predicate<String> action) {
        return Mono.fromSupplier(() -> {
            IncidentView current = require(id);
            if (!action.test(id)) {
                throw new IllegalStateException("Incident " + id + " cannot move from "
                        + current.status().value() + " to " + target.value());
            }
            return require(id);
        });
    }

    private IncidentView require(String id) {
        return engine.incident(id).orElseThrow(() -> new ResourceNotFoundException("incident", id));
    }

    @Nullable
    private static String noteOf(@Nullable IncidentNoteRequest request) {
        return request != null ? request.note() : null;
    }
}
