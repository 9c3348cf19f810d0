package com.hcpbridge.leadwebhook.domain.util;

import com.hcpbridge.leadwebhook.domain.model.ServiceAddress;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a one-line US address into street, city, state and zip.
 */
public final class AddressParser {

    private static final Pattern STREET_CITY_STATE_ZIP =
            Pattern.compile("^(.+?),\\s*(.+?),\\s*([A-Z]{2})\\s+(\\d{5}(?:-\\d{4})?)$");
    private static final Pattern STREET_CITY_STATE_ZIP_NO_COMMA =
            Pattern.compile("^(.+?),\\s*(.+?)\\s+([A-Z]{2})\\s+(\\d{5}(?:-\\d{4})?)$");
    private static final Pattern ZIP = Pattern.compile("\\b(\\d{5}(?:-\\d{4})?)\\b");
    private static final Pattern TRAILING_STATE = Pattern.compile("\\b([A-Z]{2})\\s*$");

    private AddressParser() {
    }

    public static ServiceAddress parse(String address) {
        if (address == null || address.isBlank()) {
            return new ServiceAddress(null, null, null, null, null, null);
        }
        String value = address.trim();

        for (Pattern pattern : new Pattern[]{STREET_CITY_STATE_ZIP, STREET_CITY_STATE_ZIP_NO_COMMA}) {
            Matcher m = pattern.matcher(value);
            if (m.matches()) {
                return new ServiceAddress(m.group(1), null, m.group(2), m.group(3), m.group(4), null);
            }
        }

        Matcher zip = ZIP.matcher(value);
        if (zip.find()) {
            String beforeZip = value.substring(0, zip.start()).trim();
            Matcher state = TRAILING_STATE.matcher(beforeZip);
            if (!state.find()) {
                return new ServiceAddress(stripTrailingComma(beforeZip), null, null, null, zip.group(1), null);
            }
            String[] parts = beforeZip.substring(0, state.start()).split(",");
            String street = parts[0].trim();
            String city = parts.length >= 2 ? parts[1].trim() : null;
            return new ServiceAddress(street, null, city, state.group(1), zip.group(1), null);
        }

        return new ServiceAddress(value, null, null, null, null, null);
    }

    private static String stripTrailingComma(String value) {
        return value.endsWith(",") ? value.substring(0, value.length() - 1).trim() : value;
    }
}
