package com.civicdesk.query.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Loosely-typed query record as the store holds it: an opaque id plus a map of
 * field values keyed by {@link QueryField#key()}. Absent and {@code null} are
 * treated the same.
 *
 * <p>{@code revision} is assigned by the store and grows with every committed
 * write of the record, so it orders two copies of the same query regardless of
 * the clocks of the writers. {@link #UNVERSIONED} marks a copy whose store does
 * not track revisions.</p>
 */
public record QueryDocument(String id, Map<String, Object> fields, long revision) {

    public static final long UNVERSIONED = 0L;

    public QueryDocument {
        Objects.requireNonNull(id, "id must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public QueryDocument(String id, Map<String, Object> fields) {
        this(id, fields, UNVERSIONED);
    }

    public QueryDocument withRevision(long next) {
        return new QueryDocument(id, fields, next);
    }

    public Object get(QueryField field) {
        return fields.get(field.key());
    }

    /**
     * Returns a copy with the given fields merged in; {@code null} values remove the field.
     */
    public QueryDocument merge(Map<String, Object> changes) {
        Map<String, Object> merged = new LinkedHashMap<>(fields);
        changes.forEach((key, value) -> {
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        return new QueryDocument(id, merged, revision);
    }
}
