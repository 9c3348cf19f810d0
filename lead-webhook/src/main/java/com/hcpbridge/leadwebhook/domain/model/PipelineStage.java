package com.hcpbridge.leadwebhook.domain.model;

public enum PipelineStage {
    NORMALIZING,
    MATCHING,
    RESOLVING_ADDRESS,
    ASSEMBLING,
    CREATING,
    DONE,
    FAILED
}
