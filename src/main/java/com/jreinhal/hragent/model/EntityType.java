package com.jreinhal.hragent.model;

import java.util.Locale;

/**
 * Categories of entities pulled out of an employment-standards question.
 */
public enum EntityType {
    PRODUCT("product"),
    CONCEPT("concept"),
    LEGISLATION("legislation"),
    JURISDICTION("jurisdiction"),
    ORGANIZATION("organization"),
    ROLE("role"),
    AMOUNT("amount"),
    DATE("date"),
    DURATION("duration");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    public String value() {
        return this.value;
    }

    public static EntityType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (EntityType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }
}
