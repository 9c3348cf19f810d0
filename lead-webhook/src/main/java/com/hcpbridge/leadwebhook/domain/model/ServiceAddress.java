package com.hcpbridge.leadwebhook.domain.model;

import java.util.StringJoiner;

public record ServiceAddress(
        String street,
        String streetLine2,
        String city,
        String state,
        String zip,
        String country
) {
    public ServiceAddress {
        street = clean(street);
        streetLine2 = clean(streetLine2);
        city = clean(city);
        state = clean(state);
        zip = clean(zip);
        country = clean(country);
    }

    public boolean isEmpty() {
        return street == null && streetLine2 == null && city == null && zip == null;
    }

    public ServiceAddress withDefaults(String defaultState, String defaultCountry) {
        return new ServiceAddress(street, streetLine2, city,
                state != null ? state : defaultState,
                zip,
                country != null ? country : defaultCountry);
    }

    /**
     * Renders {@code "street, line 2, city, ST zip"}, skipping absent parts.
     */
    public String oneLine() {
        StringJoiner joiner = new StringJoiner(", ");
        if (street != null) joiner.add(street);
        if (streetLine2 != null) joiner.add(streetLine2);
        if (city != null) joiner.add(city);
        String stateZip = ((state != null ? state : "") + " " + (zip != null ? zip : "")).trim();
        if (!stateZip.isEmpty()) joiner.add(stateZip);
        return joiner.toString();
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
