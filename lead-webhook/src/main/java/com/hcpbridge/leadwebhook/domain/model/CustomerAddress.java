package com.hcpbridge.leadwebhook.domain.model;

public record CustomerAddress(
        String addressId,
        ServiceAddress address
) {}
