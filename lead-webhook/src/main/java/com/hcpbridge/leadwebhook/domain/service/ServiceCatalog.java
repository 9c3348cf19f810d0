package com.hcpbridge.leadwebhook.domain.service;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Form choices and the platform names they map to. Lookups ignore case.
 */
public final class ServiceCatalog {

    private static final Map<String, String> JOB_TYPES = caseInsensitive(Map.of(
            "New Installation", "Plumbing Installation",
            "Service or Repair", "Plumbing Demand Maintenance",
            "Renovation or Remodel", "Plumbing Estimate"));

    private static final Map<String, String> LINE_ITEMS = caseInsensitive(Map.of(
            "Toilets or Bidets", "Toilet Repair & Replacement",
            "Garbage Disposal", "Garbage Disposal Service",
            "Plumbing Fixtures", "Faucet & Fixture Service",
            "Water Heater", "Water Heater Service",
            "Boilers / Combi-Boilers", "Boiler & Hydronics Service",
            "Steam / Sauna", "Steam & Sauna Service",
            "Other Plumbing", "Other Plumbing Service",
            "Other Heating & HVAC", "Other Heating Service"));

    static final String GENERIC_LINE_ITEM_PREFIX = "General Service Request: ";

    private ServiceCatalog() {
    }

    public static Optional<String> jobTypeFor(String serviceNeeded) {
        return Optional.ofNullable(serviceNeeded).map(String::trim).map(JOB_TYPES::get);
    }

    public static Optional<String> lineItemFor(String serviceDetail) {
        return Optional.ofNullable(serviceDetail).map(String::trim).map(LINE_ITEMS::get);
    }

    public static String genericLineItem(String serviceDetail) {
        return GENERIC_LINE_ITEM_PREFIX + serviceDetail.trim();
    }

    private static Map<String, String> caseInsensitive(Map<String, String> entries) {
        TreeMap<String, String> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        map.putAll(entries);
        return Collections.unmodifiableMap(map);
    }
}
