package com.hcpbridge.leadwebhook.interfaces.rest.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.hcpbridge.leadwebhook.application.usecase.CreateLeadUseCase;
import com.hcpbridge.leadwebhook.domain.exception.LeadValidationException;
import com.hcpbridge.leadwebhook.domain.model.LeadCreationResult;
import com.hcpbridge.leadwebhook.domain.model.PipelineStage;
import com.hcpbridge.leadwebhook.infrastructure.config.HcpConfig;
import com.hcpbridge.leadwebhook.interfaces.rest.SubmissionPayloadParser;
import com.hcpbridge.leadwebhook.interfaces.rest.dto.WebhookResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

@RestController
public class WebhookController {

    private static final Logger logger = LoggerFactory.getLogger(WebhookController.class);
    private final CreateLeadUseCase createLeadUseCase;
    private final SubmissionPayloadParser payloadParser;
    private final HcpConfig hcpConfig;

    public WebhookController(CreateLeadUseCase createLeadUseCase, SubmissionPayloadParser payloadParser,
                             HcpConfig hcpConfig) {
        this.createLeadUseCase = createLeadUseCase;
        this.payloadParser = payloadParser;
        this.hcpConfig = hcpConfig;
    }

    @GetMapping("/")
    public Map<String, String> home() {
        return Map.of("service", "Elfsight to HCP Lead Creator", "status", "running", "version", "1.0.0");
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        if (!hcpConfig.hasApiKey()) {
            logger.error("Configuration error: hcp.api-key is not set");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("status", "unhealthy", "error", "hcp.api-key is required"));
        }
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    @PostMapping("/webhook")
    public Mono<ResponseEntity<WebhookResponse>> webhook(
            @RequestBody(required = false) Mono<JsonNode> payload,
            @RequestHeader(value = "X-Correlation-Id", defaultValue = "") String correlationId) {
        String effectiveCorrelationId = correlationId.isEmpty() ? UUID.randomUUID().toString() : correlationId;
        return process(payload, effectiveCorrelationId)
                .map(result -> ResponseEntity.status(statusFor(result)).body(WebhookResponse.from(result)));
    }

    /**
     * Same processing as {@code /webhook}, but always answers 200 with the full result.
     */
    @PostMapping("/test")
    public Mono<ResponseEntity<WebhookResponse>> test(
            @RequestBody(required = false) Mono<JsonNode> payload,
            @RequestHeader(value = "X-Correlation-Id", defaultValue = "") String correlationId) {
        String effectiveCorrelationId = correlationId.isEmpty() ? "test-" + UUID.randomUUID() : correlationId;
        logger.info("Test endpoint called, correlationId: {}", effectiveCorrelationId);
        return process(payload, effectiveCorrelationId)
                .map(result -> ResponseEntity.ok(WebhookResponse.from(result)));
    }

    private Mono<LeadCreationResult> process(Mono<JsonNode> payload, String correlationId) {
        return payload
                .switchIfEmpty(Mono.error(() -> new LeadValidationException("Empty payload")))
                .map(payloadParser::parse)
                .doOnNext(submission -> logger.info("Received webhook payload with {} fields, correlationId: {}",
                        submission.fields().size(), correlationId))
                .flatMap(submission -> createLeadUseCase.execute(submission, correlationId));
    }

    private static HttpStatus statusFor(LeadCreationResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        if (result.failedStage() == PipelineStage.NORMALIZING) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}
