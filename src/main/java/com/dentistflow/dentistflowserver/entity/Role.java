package com.dentistflow.dentistflowserver.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    CLIENT("client"),
    DENTIST("dentist"),
    STAFF("staff");

    private final String value;
    Role(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }

    /**
     * Resolves the wire value ("client", "dentist", "staff"), case-insensitive.
     * Returns {@code null} for anything else so callers decide how to reject it.
     */
    @JsonCreator
    public static Role fromValue(String value) {
        if (value == null) return null;
        for (Role r : Role.values()) {
            if (r.value.equalsIgnoreCase(value.trim())) {
                return r;
            }
        }
        return null;
    }

    public String getAuthority() {
        return "ROLE_" + name();
    }
}
