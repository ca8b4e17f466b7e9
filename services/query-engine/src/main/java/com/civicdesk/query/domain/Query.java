package com.civicdesk.query.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A service request submitted by a municipal customer.
 *
 * <p>Instances are only built from validated store documents, so the record
 * enforces the lifecycle invariants itself: a query carries a resolution if and
 * only if it is {@link QueryStatus#RESOLVED}, and the resolution never predates
 * the submission day.</p>
 */
public record Query(
    String id,
    String referenceId,
    String accountNumber,
    String customerName,
    String contactNumber,
    String description,
    String queryType,
    Instant submissionDate,
    QueryStatus status,
    QueryAssignment assignment,
    QueryResolution resolution,
    Instant lastUpdated,
    String updatedBy
) {
    public Query {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(submissionDate, "submissionDate must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if ((status == QueryStatus.RESOLVED) != (resolution != null)) {
            throw new IllegalArgumentException(
                "Query %s: resolution details must be present exactly when status is Resolved (status=%s)"
                    .formatted(id, status.value()));
        }
        if (lastUpdated == null) {
            lastUpdated = submissionDate;
        }
    }

    public Optional<QueryAssignment> currentAssignment() {
        return Optional.ofNullable(assignment);
    }

    public Optional<QueryResolution> currentResolution() {
        return Optional.ofNullable(resolution);
    }

    public boolean isAssigned() {
        return assignment != null;
    }

    public boolean isResolved() {
        return status == QueryStatus.RESOLVED;
    }
}
