package com.hcpbridge.leadwebhook.domain.service;

import com.hcpbridge.leadwebhook.domain.exception.LeadValidationException;
import com.hcpbridge.leadwebhook.domain.model.Contact;
import com.hcpbridge.leadwebhook.domain.model.FormSubmission;
import com.hcpbridge.leadwebhook.domain.model.ServiceAddress;
import com.hcpbridge.leadwebhook.domain.util.AddressParser;
import com.hcpbridge.leadwebhook.domain.util.PhoneNumbers;
import com.hcpbridge.leadwebhook.infrastructure.config.LeadConfig;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import static com.hcpbridge.leadwebhook.domain.model.FormFieldKey.*;

/**
 * Turns the raw submitted fields into a {@link Contact}. Pure and deterministic.
 */
@Service
public class ContactNormalizer {

    private final LeadConfig leadConfig;

    public ContactNormalizer(LeadConfig leadConfig) {
        this.leadConfig = leadConfig;
    }

    public Contact normalize(FormSubmission submission) {
        String firstName = submission.value(FIRST_NAME).orElse(null);
        String lastName = submission.value(LAST_NAME).orElse(null);
        if (firstName == null && lastName == null) {
            String[] split = splitFullName(submission.value(FULL_NAME).orElse(""));
            firstName = split[0];
            lastName = split[1];
        }

        firstName = required(firstName, "first name");
        lastName = required(lastName, "last name");
        String email = required(submission.value(EMAIL).orElse(null), "email").toLowerCase(Locale.ROOT);
        String phone = normalizePhone(required(submission.value(PHONE).orElse(null), "phone"));

        ServiceAddress address = serviceAddress(submission).orElse(null);
        boolean smsConsent = submission.value(SMS_CONSENT)
                .map(v -> v.equalsIgnoreCase("true") || v.equalsIgnoreCase("yes"))
                .orElse(false);

        return new Contact(firstName, lastName, email, phone,
                address == null ? "" : address.oneLine(), address, smsConsent);
    }

    public String normalizePhone(String phone) {
        return PhoneNumbers.toNationalNumber(phone, leadConfig.defaultAreaCode())
                .orElseThrow(() -> new LeadValidationException("invalid phone"));
    }

    private Optional<ServiceAddress> serviceAddress(FormSubmission submission) {
        ServiceAddress address;
        if (submission.value(STREET).isPresent() || submission.value(CITY).isPresent() || submission.value(ZIP).isPresent()) {
            address = new ServiceAddress(
                    submission.value(STREET).orElse(null),
                    submission.value(STREET_LINE_2).orElse(null),
                    submission.value(CITY).orElse(null),
                    submission.value(STATE).orElse(null),
                    submission.value(ZIP).orElse(null),
                    null);
        } else {
            address = AddressParser.parse(submission.value(ADDRESS).orElse(null));
        }
        if (address.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(address.withDefaults(leadConfig.defaultState(), leadConfig.defaultCountry()));
    }

    // "Mary Jane Watson" -> ("Mary Jane", "Watson"); a single word has no last name
    private static String[] splitFullName(String fullName) {
        String[] parts = fullName.trim().split("\\s+");
        if (parts.length < 2) {
            return new String[]{parts[0].isEmpty() ? null : parts[0], null};
        }
        String first = String.join(" ", Arrays.copyOf(parts, parts.length - 1));
        return new String[]{first, parts[parts.length - 1]};
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new LeadValidationException(field + " is required");
        }
        return value.trim();
    }
}
