package com.civicdesk.query.domain;

import java.time.Instant;

/**
 * Write-once message telling a staff member that a query was routed to them.
 */
public record AssignmentNotificationEvent(
    String type,
    String recipientId,
    String senderId,
    String senderName,
    String queryId,
    String queryTitle,
    String queryDescription,
    boolean read,
    Instant createdAt
) {
    public static final String QUERY_ASSIGNMENT = "QUERY_ASSIGNMENT";

    private static final String DEFAULT_TITLE = "New Query Assignment";

    public static AssignmentNotificationEvent forAssignment(Query query, StaffUser assignee, Actor sender, Instant createdAt) {
        String title = query.referenceId() == null || query.referenceId().isBlank()
            ? DEFAULT_TITLE
            : query.referenceId();
        return new AssignmentNotificationEvent(
            QUERY_ASSIGNMENT,
            assignee.id(),
            sender.id(),
            sender.displayName(),
            query.id(),
            title,
            query.description() == null ? "" : query.description(),
            false,
            createdAt
        );
    }
}
