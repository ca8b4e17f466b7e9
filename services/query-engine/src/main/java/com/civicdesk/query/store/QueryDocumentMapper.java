package com.civicdesk.query.store;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.civicdesk.query.domain.Query;
import com.civicdesk.query.domain.QueryAssignment;
import com.civicdesk.query.domain.QueryResolution;
import com.civicdesk.query.domain.QueryStatus;
import com.civicdesk.query.service.ValidationException;

/**
 * Converts between store documents and validated {@link Query} records.
 *
 * <p>Documents that break an invariant group are rejected with
 * {@link InvalidQueryDocumentException} instead of being trusted. Resolution
 * fields left behind on a query that was later reopened are ignored, since the
 * status is authoritative.</p>
 */
@Component
public class QueryDocumentMapper {

    private final ZoneId zone;

    public QueryDocumentMapper(ZoneId zone) {
        this.zone = zone;
    }

    public Query toQuery(QueryDocument document) {
        String id = document.id();
        Instant submissionDate = requiredInstant(document, QueryField.SUBMISSION_DATE);
        QueryStatus status = status(document);

        QueryAssignment assignment = assignment(document);
        QueryResolution resolution = null;
        if (status == QueryStatus.RESOLVED) {
            resolution = resolution(document);
            if (resolution.resolutionDate().atZone(zone).toLocalDate()
                    .isBefore(submissionDate.atZone(zone).toLocalDate())) {
                throw new InvalidQueryDocumentException(id, "resolutionDate precedes submissionDate");
            }
        }

        try {
            return new Query(
                id,
                text(document, QueryField.REFERENCE_ID),
                text(document, QueryField.ACCOUNT_NUMBER),
                text(document, QueryField.CUSTOMER_NAME),
                text(document, QueryField.CONTACT_NUMBER),
                text(document, QueryField.DESCRIPTION),
                text(document, QueryField.QUERY_TYPE),
                submissionDate,
                status,
                assignment,
                resolution,
                instant(document, QueryField.LAST_UPDATED),
                text(document, QueryField.UPDATED_BY)
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryDocumentException(id, e.getMessage());
        }
    }

    public QueryDocument toDocument(Query query) {
        Map<String, Object> fields = new LinkedHashMap<>();
        put(fields, QueryField.REFERENCE_ID, query.referenceId());
        put(fields, QueryField.ACCOUNT_NUMBER, query.accountNumber());
        put(fields, QueryField.CUSTOMER_NAME, query.customerName());
        put(fields, QueryField.CONTACT_NUMBER, query.contactNumber());
        put(fields, QueryField.DESCRIPTION, query.description());
        put(fields, QueryField.QUERY_TYPE, query.queryType());
        put(fields, QueryField.SUBMISSION_DATE, query.submissionDate());
        put(fields, QueryField.STATUS, query.status().value());
        query.currentAssignment().ifPresent(assignment -> {
            put(fields, QueryField.ASSIGNED_TO, assignment.assignedTo());
            put(fields, QueryField.ASSIGNED_TO_NAME, assignment.assignedToName());
            put(fields, QueryField.ASSIGNED_BY, assignment.assignedBy());
            put(fields, QueryField.ASSIGNED_AT, assignment.assignedAt());
        });
        query.currentResolution().ifPresent(resolution -> {
            put(fields, QueryField.RESOLUTION_MESSAGE, resolution.message());
            put(fields, QueryField.RESOLUTION_DATE, resolution.resolutionDate());
            put(fields, QueryField.RESOLVED_BY, resolution.resolvedBy());
        });
        put(fields, QueryField.LAST_UPDATED, query.lastUpdated());
        put(fields, QueryField.UPDATED_BY, query.updatedBy());
        return new QueryDocument(query.id(), fields);
    }

    private QueryStatus status(QueryDocument document) {
        String raw = text(document, QueryField.STATUS);
        if (raw == null) {
            throw new InvalidQueryDocumentException(document.id(), "status is missing");
        }
        try {
            return QueryStatus.fromValue(raw);
        } catch (ValidationException e) {
            throw new InvalidQueryDocumentException(document.id(), e.getMessage());
        }
    }

    private QueryAssignment assignment(QueryDocument document) {
        String assignedTo = text(document, QueryField.ASSIGNED_TO);
        String assignedToName = text(document, QueryField.ASSIGNED_TO_NAME);
        String assignedBy = text(document, QueryField.ASSIGNED_BY);
        Instant assignedAt = instant(document, QueryField.ASSIGNED_AT);

        int present = count(assignedTo, assignedToName, assignedBy, assignedAt);
        if (present == 0) {
            return null;
        }
        if (present < QueryField.ASSIGNMENT_GROUP.size()) {
            throw new InvalidQueryDocumentException(document.id(), "assignment fields are only partially present");
        }
        return new QueryAssignment(assignedTo, assignedToName, assignedBy, assignedAt);
    }

    private QueryResolution resolution(QueryDocument document) {
        String message = text(document, QueryField.RESOLUTION_MESSAGE);
        Instant resolutionDate = instant(document, QueryField.RESOLUTION_DATE);
        String resolvedBy = text(document, QueryField.RESOLVED_BY);

        if (count(message, resolutionDate, resolvedBy) < QueryField.RESOLUTION_GROUP.size()) {
            throw new InvalidQueryDocumentException(document.id(), "status is Resolved but resolution fields are incomplete");
        }
        return new QueryResolution(message, resolutionDate, resolvedBy);
    }

    private static int count(Object... values) {
        int present = 0;
        for (Object value : values) {
            if (value != null) {
                present++;
            }
        }
        return present;
    }

    private static String text(QueryDocument document, QueryField field) {
        Object value = document.get(field);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private Instant requiredInstant(QueryDocument document, QueryField field) {
        Instant value = instant(document, field);
        if (value == null) {
            throw new InvalidQueryDocumentException(document.id(), field.key() + " is missing");
        }
        return value;
    }

    private Instant instant(QueryDocument document, QueryField field) {
        Object value = document.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof CharSequence) {
            String text = value.toString();
            if (text.isBlank()) {
                return null;
            }
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException e) {
                throw new InvalidQueryDocumentException(document.id(), "%s is not an ISO-8601 timestamp".formatted(field.key()));
            }
        }
        throw new InvalidQueryDocumentException(document.id(),
            "%s has unsupported type %s".formatted(field.key(), value.getClass().getSimpleName()));
    }

    private static void put(Map<String, Object> fields, QueryField field, Object value) {
        if (value != null) {
            fields.put(field.key(), value);
        }
    }
}
