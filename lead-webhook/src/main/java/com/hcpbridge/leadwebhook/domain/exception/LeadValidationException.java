package com.hcpbridge.leadwebhook.domain.exception;

/**
 * A required contact field is missing or malformed. Raised before any call to the customer platform.
 */
public class LeadValidationException extends RuntimeException {

    public LeadValidationException(String message) {
        super(message);
    }
}
