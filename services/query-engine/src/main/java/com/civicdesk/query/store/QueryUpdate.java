package com.civicdesk.query.store;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.civicdesk.query.domain.QueryAssignment;
import com.civicdesk.query.domain.QueryResolution;
import com.civicdesk.query.domain.QueryStatus;

/**
 * The set of fields one command writes. Fields not named here are left
 * untouched by the store; a field mapped to {@code null} is cleared.
 *
 * <p>Invariant groups can only be written as a whole: the builder offers
 * {@link Builder#assignment(QueryAssignment)} and
 * {@link Builder#resolution(QueryResolution)} /
 * {@link Builder#clearResolution()} rather than single-field setters.</p>
 */
public final class QueryUpdate {

    private final Map<QueryField, Object> values;

    private QueryUpdate(Map<QueryField, Object> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Named fields with their new values. Cleared fields map to {@code null}.
     */
    public Map<QueryField, Object> values() {
        return values;
    }

    public boolean names(QueryField field) {
        return values.containsKey(field);
    }

    public Object value(QueryField field) {
        return values.get(field);
    }

    /**
     * Document view keyed by {@link QueryField#key()}, preserving cleared fields as {@code null}.
     */
    public Map<String, Object> asDocumentFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        values.forEach((field, value) -> fields.put(field.key(), value));
        return fields;
    }

    @Override
    public String toString() {
        return "QueryUpdate" + values.keySet();
    }

    public static final class Builder {

        private final Map<QueryField, Object> values = new EnumMap<>(QueryField.class);

        private Builder() {
        }

        public Builder status(QueryStatus status) {
            values.put(QueryField.STATUS, Objects.requireNonNull(status, "status").value());
            return this;
        }

        public Builder assignment(QueryAssignment assignment) {
            Objects.requireNonNull(assignment, "assignment");
            values.put(QueryField.ASSIGNED_TO, assignment.assignedTo());
            values.put(QueryField.ASSIGNED_TO_NAME, assignment.assignedToName());
            values.put(QueryField.ASSIGNED_BY, assignment.assignedBy());
            values.put(QueryField.ASSIGNED_AT, assignment.assignedAt());
            return this;
        }

        public Builder resolution(QueryResolution resolution) {
            Objects.requireNonNull(resolution, "resolution");
            values.put(QueryField.RESOLUTION_MESSAGE, resolution.message());
            values.put(QueryField.RESOLUTION_DATE, resolution.resolutionDate());
            values.put(QueryField.RESOLVED_BY, resolution.resolvedBy());
            return this;
        }

        public Builder clearResolution() {
            QueryField.RESOLUTION_GROUP.forEach(field -> values.put(field, null));
            return this;
        }

        public Builder touchedBy(String actorId, Instant at) {
            values.put(QueryField.LAST_UPDATED, Objects.requireNonNull(at, "at"));
            values.put(QueryField.UPDATED_BY, Objects.requireNonNull(actorId, "actorId"));
            return this;
        }

        public QueryUpdate build() {
            if (!values.containsKey(QueryField.LAST_UPDATED)) {
                throw new IllegalStateException("Every query update must record lastUpdated/updatedBy");
            }
            return new QueryUpdate(values);
        }
    }
}
