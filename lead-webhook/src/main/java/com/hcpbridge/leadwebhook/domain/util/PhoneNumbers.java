package com.hcpbridge.leadwebhook.domain.util;

import java.util.Optional;

public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    public static String digitsOnly(String phone) {
        return phone == null ? "" : phone.replaceAll("\\D", "");
    }

    /**
     * Ten-digit national number for a submitted phone: seven digits get the default area code,
     * anything other than ten digits after that is rejected.
     */
    public static Optional<String> toNationalNumber(String phone, String defaultAreaCode) {
        String digits = digitsOnly(phone);
        if (digits.length() == 7) {
            digits = defaultAreaCode + digits;
        }
        return digits.length() == 10 ? Optional.of(digits) : Optional.empty();
    }

    /**
     * Ten-digit form of a number stored on the platform, which keeps a {@code +1} country code.
     */
    public static Optional<String> storedToNationalNumber(String phone) {
        String digits = digitsOnly(phone);
        if (digits.length() == 11 && digits.startsWith("1")) {
            digits = digits.substring(1);
        }
        return digits.length() == 10 ? Optional.of(digits) : Optional.empty();
    }

    public static String toE164(String nationalNumber) {
        return "+1" + nationalNumber;
    }
}
