package com.hcpbridge.leadwebhook.domain.model;

import java.util.List;

/**
 * Structured outcome of processing one submission.
 *
 * @param failedStage      the stage that failed, {@code null} on success
 * @param createdArtifacts platform records created before a failure, e.g. {@code "customer cus_123"}
 */
public record LeadCreationResult(
        boolean success,
        String customerId,
        String leadId,
        MatchClassification matchType,
        List<String> warnings,
        PipelineStage failedStage,
        String error,
        List<String> createdArtifacts
) {
    public LeadCreationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        createdArtifacts = createdArtifacts == null ? List.of() : List.copyOf(createdArtifacts);
    }

    public static LeadCreationResult done(String customerId, String leadId, MatchClassification matchType,
                                          List<String> warnings) {
        return new LeadCreationResult(true, customerId, leadId, matchType, warnings, null, null, List.of());
    }

    public static LeadCreationResult failed(PipelineStage stage, String error, String customerId,
                                            MatchClassification matchType, List<String> warnings,
                                            List<String> createdArtifacts) {
        return new LeadCreationResult(false, customerId, null, matchType, warnings, stage, error, createdArtifacts);
    }

    public PipelineStage stage() {
        return success ? PipelineStage.DONE : PipelineStage.FAILED;
    }
}
