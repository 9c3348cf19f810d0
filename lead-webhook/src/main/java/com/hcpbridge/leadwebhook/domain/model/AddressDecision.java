package com.hcpbridge.leadwebhook.domain.model;

public record AddressDecision(
        AddressAction action,
        String matchedAddressId,
        double similarityScore
) {
    public static AddressDecision reuse(String addressId, double score) {
        return new AddressDecision(AddressAction.REUSE, addressId, score);
    }

    public static AddressDecision createNew(double bestScore) {
        return new AddressDecision(AddressAction.CREATE_NEW, null, bestScore);
    }

    public boolean isReuse() {
        return action == AddressAction.REUSE;
    }
}
