package com.civicdesk.query.domain;

/**
 * Read-only view of a portal account as published by the staff directory.
 */
public record StaffUser(String id, String name, String email, String department, StaffRole role) {

    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return email != null ? email : id;
    }
}
