package com.civicdesk.query.domain;

import java.time.Instant;

/**
 * Intent to resolve a query, registered before the resolution message is
 * known. Holding one does not change the stored query.
 */
public record PendingResolution(
    String queryId,
    String referenceId,
    QueryStatus priorStatus,
    String proposedBy,
    Instant proposedAt
) {
}
