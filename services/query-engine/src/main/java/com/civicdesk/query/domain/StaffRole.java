package com.civicdesk.query.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Role stored against a portal account. Only {@link #ADMIN} and
 * {@link #SUPERADMIN} are staff roles; {@link #USER} is a customer.
 */
public enum StaffRole {
    USER("user"),
    ADMIN("admin"),
    SUPERADMIN("superadmin");

    private final String value;

    StaffRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<StaffRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(role -> role.value.equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
