package com.hcpbridge.leadwebhook.domain.model;

import java.util.List;

/**
 * Read-only copy of a customer record held by the platform.
 */
public record CustomerCandidate(
        String customerId,
        String phone,
        String email,
        List<CustomerAddress> addresses
) {
    public CustomerCandidate {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }
}
