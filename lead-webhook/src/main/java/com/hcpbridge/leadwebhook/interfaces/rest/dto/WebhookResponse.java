package com.hcpbridge.leadwebhook.interfaces.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hcpbridge.leadwebhook.domain.model.LeadCreationResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record WebhookResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("customerId") String customerId,
        @JsonProperty("leadId") String leadId,
        @JsonProperty("matchType") String matchType,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("stage") String stage,
        @JsonProperty("error") String error,
        @JsonProperty("createdArtifacts") List<String> createdArtifacts
) {
    public static WebhookResponse from(LeadCreationResult result) {
        String matchType = result.matchType() == null ? null : result.matchType().label();
        if (result.success()) {
            return new WebhookResponse(true, "Lead created successfully (match type: " + matchType + ")",
                    result.customerId(), result.leadId(), matchType, result.warnings(), null, null, null);
        }
        return new WebhookResponse(false, null, result.customerId(), null, matchType, result.warnings(),
                result.failedStage().name(), result.error(), result.createdArtifacts());
    }

    public static WebhookResponse error(String stage, String error) {
        return new WebhookResponse(false, null, null, null, null, null, stage, error, null);
    }
}
