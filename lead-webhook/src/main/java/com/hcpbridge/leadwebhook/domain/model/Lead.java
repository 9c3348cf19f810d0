package com.hcpbridge.leadwebhook.domain.model;

import java.util.List;

/**
 * The lead body sent to the platform. {@code addressId} is {@code null} when no service address was submitted.
 */
public record Lead(
        String customerId,
        String addressId,
        String employeeId,
        String leadSource,
        String jobType,
        List<LineItem> lineItems,
        String privateNote,
        List<String> warnings
) {
    public Lead {
        lineItems = List.copyOf(lineItems);
        warnings = List.copyOf(warnings);
    }
}
