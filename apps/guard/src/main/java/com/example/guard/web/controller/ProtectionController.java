package com.example.guard.web.controller;

import com.example.guard.common.util.ClientIpExtractor;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.engine.ProtectionEngine;
import com.example.guard.progression.ProtectionDecision;
import com.example.guard.progression.RateDecision;
import com.example.guard.sanitize.ClassificationResult;
import com.example.guard.web.model.request.ChallengeRequest;
import com.example.guard.web.model.request.ClassifyRequest;
import com.example.guard.web.model.request.ReportRequest;
import com.example.guard.web.model.request.VerificationRequest;
import com.example.guard.web.model.response.ChallengeResponse;
import com.example.guard.web.model.response.VerificationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Ingestion API used by the booking services: attempt and request outcomes,
 * CAPTCHA challenges and input classification.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/protection")
@RequiredArgsConstructor
public class ProtectionController {

    private final ProtectionEngine engine;

    @PostMapping("/attempts")
    public Mono<ProtectionDecision> reportAttempt(@Valid @RequestBody ReportRequest request,
                                                  ServerWebExchange exchange) {
        log.debug("POST /attempts - identifier: {}, endpoint: {}, success: {}",
                StringSanitizer.forLog(request.identifier()), StringSanitizer.forLog(request.endpoint()),
                request.success());
        return Mono.fromSupplier(() -> engine.reportAttempt(request.identifier(), request.endpoint(),
                request.success(), request.toMetadata(networkAddress(request, exchange))));
    }

    /**
     * Answers 429 with {@code Retry-After} when the identifier is blocked; the
     * decision body is returned either way.
     */
    @PostMapping("/requests")
    public Mono<ResponseEntity<RateDecision>> reportRequest(@Valid @RequestBody ReportRequest request,
                                                            ServerWebExchange exchange) {
        log.debug("POST /requests - identifier: {}, endpoint: {}",
                StringSanitizer.forLog(request.identifier()), StringSanitizer.forLog(request.endpoint()));
        return Mono.fromSupplier(() -> engine.reportRequest(request.identifier(), request.endpoint(),
                        request.success(), request.toMetadata(networkAddress(request, exchange))))
                .map(ProtectionController::toResponse);
    }

    @PostMapping("/captcha/challenges")
    public Mono<ResponseEntity<ChallengeResponse>> issueChallenge(@Valid @RequestBody ChallengeRequest request) {
        return Mono.fromSupplier(() -> engine.issueChallenge(request.identifier(), request.type()))
                .map(challenge -> ResponseEntity.status(HttpStatus.CREATED).body(ChallengeResponse.from(challenge)));
    }

    @PostMapping("/captcha/verifications")
    public Mono<VerificationResponse> verifyChallenge(@Valid @RequestBody VerificationRequest request) {
        return Mono.fromSupplier(() -> new VerificationResponse(request.identifier(),
                engine.verifyChallenge(request.identifier(), request.response())));
    }

    @PostMapping("/inputs/classify")
    public Mono<ClassificationResult> classify(@Valid @RequestBody ClassifyRequest request) {
        return Mono.fromSupplier(() -> switch (request.format()) {
            case "email" -> engine.classifyEmail(request.text());
            case "phone" -> engine.classifyPhone(request.text());
            default -> engine.classifyInput(request.identifier(), request.endpoint(), request.text(),
                    request.context());
        });
    }

    static ResponseEntity<RateDecision> toResponse(RateDecision decision) {
        if (!decision.blocked()) {
            return ResponseEntity.ok(decision);
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (decision.retryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        }
        return builder.body(decision);
    }

    private static String networkAddress(ReportRequest request, ServerWebExchange exchange) {
        String address = ClientIpExtractor.resolve(request.networkAddress(), exchange);
        return ClientIpExtractor.UNKNOWN.equals(address) ? null : address;
    }
}
