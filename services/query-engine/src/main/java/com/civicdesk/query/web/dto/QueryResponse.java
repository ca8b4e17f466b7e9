package com.civicdesk.query.web.dto;

import java.time.Instant;

import com.civicdesk.query.domain.QueryStatus;

/**
 * Flat view of a query as the admin portal's query table reads it. Assignment
 * and resolution fields are {@code null} when the query has none.
 */
public record QueryResponse(
    String id,
    String referenceId,
    String accountNumber,
    String customerName,
    String contactNumber,
    String description,
    String queryType,
    Instant submissionDate,
    QueryStatus status,
    String assignedTo,
    String assignedToName,
    String assignedBy,
    Instant assignedAt,
    String resolutionMessage,
    Instant resolutionDate,
    String resolvedBy,
    Instant lastUpdated,
    String updatedBy
) {
}
