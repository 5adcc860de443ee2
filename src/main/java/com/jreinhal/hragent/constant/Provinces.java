package com.jreinhal.hragent.constant;

import java.util.Locale;
import java.util.Map;

/**
 * Canadian jurisdictions covered by the employment-standards knowledge base.
 */
public final class Provinces {
    /**
     * Passages tagged with this code apply to every province.
     */
    public static final String ALL = "ALL";

    public static final Map<String, String> NAMES = Map.of(
            "MB", "Manitoba",
            "ON", "Ontario",
            "SK", "Saskatchewan",
            "AB", "Alberta",
            "BC", "British Columbia"
    );

    private Provinces() {
    }

    public static String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Full name for a province code. Unknown codes are returned as given.
     */
    public static String displayName(String code) {
        if (code == null) {
            return null;
        }
        return NAMES.getOrDefault(normalize(code), code);
    }
}
