package com.civicdesk.query.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Resolution details captured when a query moves into {@link QueryStatus#RESOLVED}.
 *
 * @param message        free-text explanation given to the customer
 * @param resolutionDate start of the day (engine zone) on which the query was resolved
 * @param resolvedBy     display name of the staff member who resolved it
 */
public record QueryResolution(String message, Instant resolutionDate, String resolvedBy) {

    public QueryResolution {
        Objects.requireNonNull(resolutionDate, "resolutionDate must not be null");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("resolution message must not be blank");
        }
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new IllegalArgumentException("resolvedBy must not be blank");
        }
    }
}
