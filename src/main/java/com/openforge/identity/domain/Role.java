package com.openforge.identity.domain;

public enum Role {
    USER,
    ADMIN;

    /** Lower-case wire form: "user" | "admin". */
    public String wireName() {
        return name().toLowerCase();
    }

    public String authority() {
        return "ROLE_" + name();
    }

    public static Role fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("role is required");
        return Role.valueOf(value.trim().toUpperCase());
    }
}
