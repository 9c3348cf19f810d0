package com.hcpbridge.leadwebhook.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsPublisher {

    private final MeterRegistry meterRegistry;

    public MetricsPublisher(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void incrementLeadProcessing(String status) {
        meterRegistry.counter("lead.processing.count", "status", status).increment();
    }

    public void incrementHcpRequest(String operation, String status) {
        meterRegistry.counter("hcp.request.count", "operation", operation, "status", status).increment();
    }

    public void incrementLeadWarnings(int count) {
        meterRegistry.counter("lead.warning.count").increment(count);
    }
}
