package com.hcpbridge.leadwebhook.domain.model;

/**
 * A submitter's contact details after normalization.
 *
 * @param email          trimmed and lowercased
 * @param phone          ten digits, area code included
 * @param rawAddress     one-line address as submitted, empty when no address was given
 * @param serviceAddress structured form of {@code rawAddress}, {@code null} when no address was given
 */
public record Contact(
        String firstName,
        String lastName,
        String email,
        String phone,
        String rawAddress,
        ServiceAddress serviceAddress,
        boolean smsConsent
) {
    public boolean hasAddress() {
        return serviceAddress != null;
    }
}
