package com.hcpbridge.leadwebhook.domain.model;

import java.util.Locale;

public enum MatchedField {
    PHONE,
    EMAIL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
