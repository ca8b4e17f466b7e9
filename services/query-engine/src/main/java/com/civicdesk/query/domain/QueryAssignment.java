package com.civicdesk.query.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * The staff member currently responsible for a query. The four fields travel
 * together: a query is either fully assigned or not assigned at all.
 *
 * @param assignedTo     staff id of the assignee
 * @param assignedToName display name of the assignee at assignment time
 * @param assignedBy     staff id of the superadmin who made the assignment
 * @param assignedAt     when the assignment was written
 */
public record QueryAssignment(
    String assignedTo,
    String assignedToName,
    String assignedBy,
    Instant assignedAt
) {
    public QueryAssignment {
        Objects.requireNonNull(assignedTo, "assignedTo must not be null");
        Objects.requireNonNull(assignedToName, "assignedToName must not be null");
        Objects.requireNonNull(assignedBy, "assignedBy must not be null");
        Objects.requireNonNull(assignedAt, "assignedAt must not be null");
    }
}
