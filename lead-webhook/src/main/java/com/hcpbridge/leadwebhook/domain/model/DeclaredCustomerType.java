package com.hcpbridge.leadwebhook.domain.model;

import java.util.Locale;

/**
 * What the submitter said about themselves in the "new or existing customer" field.
 */
public enum DeclaredCustomerType {
    EXISTING,
    NEW,
    UNSPECIFIED;

    public static DeclaredCustomerType from(String declared) {
        if (declared == null || declared.isBlank()) {
            return UNSPECIFIED;
        }
        String value = declared.toLowerCase(Locale.ROOT);
        if (value.contains("existing") || value.contains("returning")) {
            return EXISTING;
        }
        if (value.contains("new")) {
            return NEW;
        }
        return UNSPECIFIED;
    }

    public boolean claimsExisting() {
        return this == EXISTING;
    }
}
