package com.hcpbridge.leadwebhook.infrastructure.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * @param requestDelaySeconds minimum gap between two calls to the platform, in (fractional) seconds
 */
@ConfigurationProperties(prefix = "hcp")
@Validated
public record HcpConfig(
        @NotBlank String baseUrl,
        String apiKey,
        Duration timeout,
        @DecimalMin("0.0") Double requestDelaySeconds
) {
    public HcpConfig {
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
        if (requestDelaySeconds == null) {
            requestDelaySeconds = 2.0;
        }
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration requestDelay() {
        return Duration.ofMillis(Math.round(requestDelaySeconds * 1000));
    }
}
