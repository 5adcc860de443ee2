package com.jreinhal.hragent.retrieval;

import com.jreinhal.hragent.constant.MetadataConstants;
import com.jreinhal.hragent.constant.Provinces;

/**
 * Portable vector-store filter expressions restricting passages by jurisdiction.
 */
public final class ProvinceFilterExpression {
    private static final String PROVINCE_OR_ALL_TEMPLATE = MetadataConstants.PROVINCE_KEY + " in ['%s', '%s']";

    private ProvinceFilterExpression() {
    }

    /**
     * Passages of the given province plus passages tagged for every province; {@code null} when no
     * province is given.
     */
    public static String forProvince(String province) {
        if (province == null || province.isBlank()) {
            return null;
        }
        return String.format(PROVINCE_OR_ALL_TEMPLATE, escapeValue(Provinces.normalize(province)), Provinces.ALL);
    }

    static String escapeValue(String value) {
        if (value == null) {
            return "";
        }
        // Backslashes first, so an escaped quote cannot be unescaped again.
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
