package com.hcpbridge.leadwebhook.interfaces.rest;

import com.hcpbridge.leadwebhook.domain.exception.LeadValidationException;
import com.hcpbridge.leadwebhook.domain.model.PipelineStage;
import com.hcpbridge.leadwebhook.interfaces.rest.dto.WebhookResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(LeadValidationException.class)
    public Mono<ResponseEntity<WebhookResponse>> handleValidationException(LeadValidationException e) {
        logger.warn("Validation error: {}", e.getMessage());
        return Mono.just(ResponseEntity.badRequest()
                .body(WebhookResponse.error(PipelineStage.NORMALIZING.name(), e.getMessage())));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<WebhookResponse>> handleUnreadablePayload(ServerWebInputException e) {
        logger.warn("Unreadable payload: {}", e.getReason());
        return Mono.just(ResponseEntity.badRequest()
                .body(WebhookResponse.error(PipelineStage.NORMALIZING.name(), "Payload is not valid JSON")));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<WebhookResponse>> handleUnexpectedException(Exception e) {
        logger.error("Unexpected error in webhook handler", e);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(WebhookResponse.error(null, "Internal server error")));
    }
}
