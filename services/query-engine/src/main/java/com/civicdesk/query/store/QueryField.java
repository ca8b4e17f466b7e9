package com.civicdesk.query.store;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Named fields of a stored query document. The document key is what the portal
 * front end reads; the column is the relational name used by the R2DBC adapter.
 */
public enum QueryField {
    REFERENCE_ID("referenceId", "reference_id", String.class),
    ACCOUNT_NUMBER("accountNumber", "account_number", String.class),
    CUSTOMER_NAME("customerName", "customer_name", String.class),
    CONTACT_NUMBER("contactNumber", "contact_number", String.class),
    DESCRIPTION("description", "description", String.class),
    QUERY_TYPE("queryType", "query_type", String.class),
    SUBMISSION_DATE("submissionDate", "submission_date", Instant.class),
    STATUS("status", "status", String.class),
    ASSIGNED_TO("assignedTo", "assigned_to", String.class),
    ASSIGNED_TO_NAME("assignedToName", "assigned_to_name", String.class),
    ASSIGNED_BY("assignedBy", "assigned_by", String.class),
    ASSIGNED_AT("assignedAt", "assigned_at", Instant.class),
    RESOLUTION_MESSAGE("resolutionMessage", "resolution_message", String.class),
    RESOLUTION_DATE("resolutionDate", "resolution_date", Instant.class),
    RESOLVED_BY("resolvedBy", "resolved_by", String.class),
    LAST_UPDATED("lastUpdated", "last_updated", Instant.class),
    UPDATED_BY("updatedBy", "updated_by", String.class);

    public static final Set<QueryField> ASSIGNMENT_GROUP =
        EnumSet.of(ASSIGNED_TO, ASSIGNED_TO_NAME, ASSIGNED_BY, ASSIGNED_AT);

    public static final Set<QueryField> RESOLUTION_GROUP =
        EnumSet.of(RESOLUTION_MESSAGE, RESOLUTION_DATE, RESOLVED_BY);

    private final String key;
    private final String column;
    private final Class<?> type;

    QueryField(String key, String column, Class<?> type) {
        this.key = key;
        this.column = column;
        this.type = type;
    }

    public String key() {
        return key;
    }

    public String column() {
        return column;
    }

    public Class<?> type() {
        return type;
    }
}
