package com.hcpbridge.leadwebhook.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Semantic meaning of a submitted field, recognised from the field label by case-insensitive substring.
 * Constants are tried in declaration order, so the more specific labels come first
 * ("Email Address" is an email, not an address).
 */
public enum FormFieldKey {
    SMS_CONSENT(n -> n.contains("sms") && n.contains("consent")),
    FIRST_NAME(n -> n.contains("first name")),
    LAST_NAME(n -> n.contains("last name")),
    EMAIL(n -> n.contains("email")),
    PHONE(n -> n.contains("phone")),
    STREET_LINE_2(n -> n.contains("line 2")),
    STREET(n -> n.contains("street")),
    CITY(n -> n.contains("city")),
    STATE(n -> n.contains("state") && !n.contains("service")),
    ZIP(n -> n.contains("zip") || n.contains("postal")),
    CUSTOMER_TYPE(n -> n.contains("new or existing") || n.contains("are you") || n.contains("customer type")),
    PREFERRED_CONTACT(n -> n.contains("preferred method") || n.contains("contact method") || n.contains("preferred contact")),
    SERVICE_NEEDED(n -> n.contains("service needed")),
    SERVICE_DETAILS(n -> n.contains("service details")),
    REQUEST_DETAILS(n -> n.contains("request details")),
    ATTACHMENTS(n -> n.contains("images") || n.contains("plans") || n.contains("specs") || n.contains("attachment")),
    ADDRESS(n -> n.contains("address")),
    FULL_NAME(n -> n.equals("name") || n.equals("full name") || n.equals("your name"));

    private final Predicate<String> matcher;

    FormFieldKey(Predicate<String> matcher) {
        this.matcher = matcher;
    }

    public static Optional<FormFieldKey> classify(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return Optional.empty();
        }
        String normalized = fieldName.toLowerCase(Locale.ROOT)
                .replace('_', ' ')
                .replace('-', ' ')
                .trim();
        return Arrays.stream(values())
                .filter(key -> key.matcher.test(normalized))
                .findFirst();
    }
}
