package com.civicdesk.query.domain;

/**
 * Headline counters shown above the query table.
 */
public record StatusSummary(long open, long active, long resolved, long unassigned, long total) {
}
