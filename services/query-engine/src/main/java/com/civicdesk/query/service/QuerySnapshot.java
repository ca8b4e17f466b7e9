package com.civicdesk.query.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.civicdesk.query.domain.Query;
import com.civicdesk.query.domain.QueryChangeEvent;
import com.civicdesk.query.store.QueryDocument;

/**
 * Immutable view of the live query set at one point of the subscription.
 *
 * <p>Every change produces a new snapshot (copy-on-write), so a snapshot handed
 * to a reader never changes underneath it. {@link #version()} increases with
 * every applied change.</p>
 *
 * <p>Copies of the same query are ordered by the store revision they were read
 * at. Only when a copy carries no revision does the snapshot fall back to
 * {@code lastUpdated}.</p>
 */
public final class QuerySnapshot {

    public static final QuerySnapshot EMPTY = new QuerySnapshot(Map.of(), Map.of(), Set.of(), 0);

    private final Map<String, Query> queries;
    private final Map<String, Long> revisions;
    private final Set<String> rejectedIds;
    private final long version;

    private QuerySnapshot(Map<String, Query> queries, Map<String, Long> revisions, Set<String> rejectedIds, long version) {
        this.queries = queries;
        this.revisions = revisions;
        this.rejectedIds = rejectedIds;
        this.version = version;
    }

    public static QuerySnapshot of(Collection<Query> queries) {
        Map<String, Query> byId = new LinkedHashMap<>();
        queries.forEach(query -> byId.put(query.id(), query));
        return new QuerySnapshot(Collections.unmodifiableMap(byId), Map.of(), Set.of(), 1);
    }

    public QuerySnapshot upsert(Query query) {
        return upsert(query, QueryDocument.UNVERSIONED);
    }

    /**
     * Adds or replaces a query read at {@code revision}. A copy at or below the
     * revision already held is ignored, so neither a replayed read racing a live
     * change nor two writes whose read-backs arrive out of commit order can roll
     * the snapshot back.
     */
    public QuerySnapshot upsert(Query query, long revision) {
        if (isStale(query, revision)) {
            return this;
        }
        Map<String, Query> next = new LinkedHashMap<>(queries);
        next.put(query.id(), query);
        return new QuerySnapshot(Collections.unmodifiableMap(next), withRevision(query.id(), revision),
            withoutRejected(query.id()), version + 1);
    }

    public QuerySnapshot remove(String id) {
        if (!queries.containsKey(id) && !rejectedIds.contains(id)) {
            return this;
        }
        Map<String, Query> next = new LinkedHashMap<>(queries);
        next.remove(id);
        Map<String, Long> nextRevisions = new LinkedHashMap<>(revisions);
        nextRevisions.remove(id);
        return new QuerySnapshot(Collections.unmodifiableMap(next), Collections.unmodifiableMap(nextRevisions),
            withoutRejected(id), version + 1);
    }

    public QuerySnapshot reject(String id) {
        return reject(id, QueryDocument.UNVERSIONED);
    }

    /**
     * Flags a document that failed validation. Any earlier valid version of it
     * leaves the snapshot, since it no longer reflects the store.
     */
    public QuerySnapshot reject(String id, long revision) {
        long held = revisionOf(id);
        if (revision != QueryDocument.UNVERSIONED && held != QueryDocument.UNVERSIONED && revision <= held) {
            return this;
        }
        Map<String, Query> next = new LinkedHashMap<>(queries);
        next.remove(id);
        Set<String> rejected = new LinkedHashSet<>(rejectedIds);
        rejected.add(id);
        return new QuerySnapshot(Collections.unmodifiableMap(next), withRevision(id, revision),
            Collections.unmodifiableSet(rejected), version + 1);
    }

    public Collection<Query> queries() {
        return queries.values();
    }

    public Optional<Query> find(String id) {
        return Optional.ofNullable(queries.get(id));
    }

    public int size() {
        return queries.size();
    }

    public Set<String> rejectedIds() {
        return rejectedIds;
    }

    public long version() {
        return version;
    }

    /**
     * Store revision of the copy held for {@code id}, or {@link QueryDocument#UNVERSIONED}.
     */
    public long revisionOf(String id) {
        return revisions.getOrDefault(id, QueryDocument.UNVERSIONED);
    }

    /**
     * Deltas that turn {@code previous} into this snapshot.
     */
    public List<QueryChangeEvent> changesSince(QuerySnapshot previous) {
        List<QueryChangeEvent> changes = new ArrayList<>();
        queries.forEach((id, query) -> {
            Query before = previous.queries.get(id);
            if (before == null) {
                changes.add(QueryChangeEvent.added(query));
            } else if (!before.equals(query)) {
                changes.add(QueryChangeEvent.modified(query));
            }
        });
        previous.queries.forEach((id, query) -> {
            if (!queries.containsKey(id)) {
                changes.add(QueryChangeEvent.removed(query));
            }
        });
        return changes;
    }

    private boolean isStale(Query query, long revision) {
        long held = revisionOf(query.id());
        if (revision != QueryDocument.UNVERSIONED && held != QueryDocument.UNVERSIONED) {
            return revision <= held;
        }
        Query existing = queries.get(query.id());
        return existing != null && query.lastUpdated().isBefore(existing.lastUpdated());
    }

    private Map<String, Long> withRevision(String id, long revision) {
        Map<String, Long> next = new LinkedHashMap<>(revisions);
        if (revision == QueryDocument.UNVERSIONED) {
            next.remove(id);
        } else {
            next.put(id, revision);
        }
        return Collections.unmodifiableMap(next);
    }

    private Set<String> withoutRejected(String id) {
        if (!rejectedIds.contains(id)) {
            return rejectedIds;
        }
        Set<String> rejected = new LinkedHashSet<>(rejectedIds);
        rejected.remove(id);
        return Collections.unmodifiableSet(rejected);
    }
}
