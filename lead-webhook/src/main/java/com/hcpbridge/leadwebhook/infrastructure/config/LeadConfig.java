package com.hcpbridge.leadwebhook.infrastructure.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "lead")
@Validated
public record LeadConfig(
        @NotBlank String employeeId,
        @NotBlank String leadSource,
        @Pattern(regexp = "\\d{3}") String defaultAreaCode,
        @NotBlank String defaultState,
        @NotBlank String defaultCountry,
        @NotBlank String defaultJobType,
        @DecimalMin("0.0") @DecimalMax("1.0") double addressSimilarityThreshold
) {}
