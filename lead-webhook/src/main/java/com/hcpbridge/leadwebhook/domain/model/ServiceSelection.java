package com.hcpbridge.leadwebhook.domain.model;

import java.util.List;

/**
 * Job type and line items mapped from the submitted service fields, with a warning per unmapped value.
 */
public record ServiceSelection(
        String jobType,
        List<LineItem> lineItems,
        List<String> warnings
) {
    public ServiceSelection {
        lineItems = List.copyOf(lineItems);
        warnings = List.copyOf(warnings);
    }
}
