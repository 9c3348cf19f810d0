package com.hcpbridge.leadwebhook.domain.model;

import java.math.BigDecimal;

/**
 * A quote-only line item; staff set the price later.
 *
 * @param details free-text request details, only ever set on the first item of a lead
 */
public record LineItem(
        String description,
        int quantity,
        BigDecimal unitPrice,
        String details
) {
    public static LineItem quoteOnly(String description, String details) {
        return new LineItem(description, 1, BigDecimal.ZERO, details);
    }
}
