package com.civicdesk.query.domain;

import java.util.Arrays;

import com.civicdesk.query.service.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a customer query.
 *
 * <p>The stored representation is the capitalised label ({@code "Open"},
 * {@code "Active"}, {@code "Resolved"}) used by the portal front end, so
 * {@link #value()} is what goes over the wire and into the store.</p>
 */
public enum QueryStatus {
    OPEN("Open"),
    ACTIVE("Active"),
    RESOLVED("Resolved");

    private final String value;

    QueryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a stored or user-supplied label. Matching is case-insensitive and
     * accepts the enum constant name as well.
     *
     * @throws ValidationException when the label is not a known status
     */
    @JsonCreator
    public static QueryStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Status must not be blank");
        }
        String candidate = value.trim();
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(candidate) || status.name().equalsIgnoreCase(candidate))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown query status '%s'".formatted(value)));
    }
}
