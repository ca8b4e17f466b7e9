package com.civicdesk.query.domain;

import java.util.Objects;

/**
 * The authenticated staff member on whose behalf a command runs.
 */
public record Actor(String id, String displayName, StaffRole role) {

    public Actor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(role, "role must not be null");
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
    }

    public static Actor of(StaffUser user) {
        return new Actor(user.id(), user.displayName(), user.role());
    }
}
