package com.example.guard.web.controller;

import com.example.guard.common.exception.ResourceNotFoundException;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.detection.AttackPattern;
import com.example.guard.engine.ProtectionEngine;
import com.example.guard.engine.ProtectionStatistics;
import com.example.guard.policy.SecurityPolicy;
import com.example.guard.progression.ProtectionConfig;
import com.example.guard.rule.RateLimitRule;
import com.example.guard.threat.SystemHealth;
import com.example.guard.threat.ThreatLevel;
import com.example.guard.web.model.request.AttackPatternRequest;
import com.example.guard.web.model.request.BlockRequest;
import com.example.guard.web.model.request.LockoutRequest;
import com.example.guard.web.model.request.PolicyRequest;
import com.example.guard.web.model.request.ProtectionConfigRequest;
import com.example.guard.web.model.request.RateLimitRuleRequest;
import com.example.guard.web.model.request.ResetRequest;
import com.example.guard.web.model.request.SecurityEventRequest;
import com.example.guard.web.model.response.BlockResponse;
import com.example.guard.web.model.response.LockoutResponse;
import com.example.guard.web.model.response.OperationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Admin surface for runtime configuration, manual enforcement and monitoring.
 * Every mutating call is written to the security audit log by the engine.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/protection")
@RequiredArgsConstructor
public class ProtectionAdminController {

    private final ProtectionEngine engine;
    private final Clock clock;

    // --- endpoint configs ---

    @GetMapping("/configs")
    public Mono<Map<String, ProtectionConfig>> listConfigs() {
        return Mono.fromSupplier(engine::protectionConfigs);
    }

    @PutMapping("/configs/{endpoint}")
    public Mono<ProtectionConfig> registerConfig(@PathVariable String endpoint,
                                                 @Valid @RequestBody ProtectionConfigRequest request) {
        log.info("PUT /configs/{}", StringSanitizer.forLog(endpoint));
        return Mono.fromSupplier(() -> {
            ProtectionConfig config = request.toConfig();
            engine.registerProtectionConfig(endpoint, config);
            return config;
        });
    }

    // --- rate-limit rules ---

    @GetMapping("/rules")
    public Mono<List<RateLimitRule>> listRules() {
        return Mono.fromSupplier(engine::rateLimitRules);
    }

    @PostMapping("/rules")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<RateLimitRule> registerRule(@Valid @RequestBody RateLimitRuleRequest request) {
        log.info("POST /rules - name: {}", StringSanitizer.forLog(request.name()));
        return Mono.fromSupplier(() -> {
            RateLimitRule rule = request.toRule();
            engine.registerRateLimitRule(rule);
            return rule;
        });
    }

    @DeleteMapping("/rules/{name}")
    public Mono<OperationResponse> removeRule(@PathVariable String name) {
        return Mono.fromSupplier(() -> {
            if (!engine.removeRateLimitRule(name)) {
                throw new ResourceNotFoundException("rate_limit_rule", name);
            }
            return new OperationResponse("remove_rule", name, true);
        });
    }

    // --- attack patterns ---

    @GetMapping("/patterns")
    public Mono<List<AttackPattern>> listPatterns() {
        return Mono.fromSupplier(engine::attackPatterns);
    }

    @PostMapping("/patterns")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AttackPattern> addPattern(@Valid @RequestBody AttackPatternRequest request) {
        return Mono.fromSupplier(() -> {
            AttackPattern pattern = request.toPattern();
            engine.addAttackPattern(pattern);
            return pattern;
        });
    }

    // --- policies ---

    @GetMapping("/policies")
    public Mono<List<SecurityPolicy>> listPolicies() {
        return Mono.fromSupplier(engine::policies);
    }

    @PostMapping("/policies")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SecurityPolicy> registerPolicy(@Valid @RequestBody PolicyRequest request) {
        log.info("POST /policies - name: {}", StringSanitizer.forLog(request.name()));
        return Mono.fromSupplier(() -> {
            SecurityPolicy policy = request.toPolicy();
            engine.registerPolicy(policy);
            return policy;
        });
    }

    @PutMapping("/policies/{name}/enabled")
    public Mono<OperationResponse> setPolicyEnabled(@PathVariable String name, @RequestParam boolean value) {
        return Mono.fromSupplier(() -> {
            if (engine.policies().stream().noneMatch(policy -> policy.name().equals(name))) {
                throw new ResourceNotFoundException("policy", name);
            }
            return new OperationResponse(value ? "enable_policy" : "disable_policy", name,
                    engine.setPolicyEnabled(name, value));
        });
    }

    @DeleteMapping("/policies/{name}")
    public Mono<OperationResponse> removePolicy(@PathVariable String name) {
        return Mono.fromSupplier(() -> {
            if (!engine.removePolicy(name)) {
                throw new ResourceNotFoundException("policy", name);
            }
            return new OperationResponse("remove_policy", name, true);
        });
    }

    // --- lockouts and blocks ---

    @PostMapping("/lockouts")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<LockoutResponse> lockout(@Valid @RequestBody LockoutRequest request) {
        return Mono.fromSupplier(() -> {
            Instant until = engine.lockout(request.identifier(), request.endpoint(), request.duration());
            return new LockoutResponse(request.identifier(), request.endpoint(), true, until);
        });
    }

    @GetMapping("/lockouts")
    public Mono<LockoutResponse> lockoutStatus(@RequestParam String identifier, @RequestParam String endpoint) {
        return Mono.fromSupplier(() -> engine.lockedUntil(identifier, endpoint)
                .map(until -> new LockoutResponse(identifier, endpoint, true, until))
                .orElseGet(() -> new LockoutResponse(identifier, endpoint, false, null)));
    }

    @DeleteMapping("/lockouts")
    public Mono<OperationResponse> releaseLockout(@RequestParam String identifier, @RequestParam String endpoint) {
        return Mono.fromSupplier(() -> new OperationResponse("release_lockout", identifier,
                engine.releaseLockout(identifier, endpoint)));
    }

    @PostMapping("/blocks")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<BlockResponse> block(@Valid @RequestBody BlockRequest request) {
        return Mono.fromSupplier(() -> new BlockResponse(request.identifier(), true,
                engine.block(request.identifier(), request.duration())));
    }

    @GetMapping("/blocks/{identifier}")
    public Mono<BlockResponse> blockStatus(@PathVariable String identifier) {
        return Mono.fromSupplier(() -> engine.blockedUntil(identifier)
                .map(until -> new BlockResponse(identifier, true, until))
                .orElseGet(() -> new BlockResponse(identifier, false, null)));
    }

    @DeleteMapping("/blocks/{identifier}")
    public Mono<OperationResponse> unblock(@PathVariable String identifier) {
        return Mono.fromSupplier(() -> new OperationResponse("unblock", identifier, engine.unblock(identifier)));
    }

    @PostMapping("/resets")
    public Mono<OperationResponse> reset(@Valid @RequestBody ResetRequest request) {
        return Mono.fromSupplier(() -> {
            engine.reset(request.identifier(), StringSanitizer.trimToNull(request.endpoint()));
            return new OperationResponse("reset", request.identifier(), true);
        });
    }

    // --- events and monitoring ---

    @PostMapping("/events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<OperationResponse> recordEvent(@Valid @RequestBody SecurityEventRequest request) {
        return Mono.fromSupplier(() -> {
            engine.recordEvent(request.toEvent(clock.instant()));
            return new OperationResponse("record_event", request.type(), true);
        });
    }

    @GetMapping("/metrics")
    public Mono<ProtectionStatistics> statistics() {
        return Mono.fromSupplier(engine::statistics);
    }

    @GetMapping("/threat-level")
    public Mono<ThreatLevel> threatLevel() {
        return Mono.fromSupplier(engine::threatLevel);
    }

    @GetMapping("/health")
    public Mono<SystemHealth> health() {
        return Mono.fromSupplier(engine::health);
    }
}
