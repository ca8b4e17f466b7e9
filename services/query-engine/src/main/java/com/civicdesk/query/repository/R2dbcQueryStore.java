package com.civicdesk.query.repository;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;

import com.civicdesk.query.config.EngineProperties;
import com.civicdesk.query.domain.ChangeType;
import com.civicdesk.query.store.QueryDocument;
import com.civicdesk.query.store.QueryDocumentChange;
import com.civicdesk.query.store.QueryField;
import com.civicdesk.query.store.QueryStore;
import com.civicdesk.query.store.QueryUpdate;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * {@link QueryStore} over the {@code queries} table.
 *
 * <p>Every row carries a {@code revision} that each merge increments inside its
 * {@code UPDATE}. A subscription rescans the table every
 * {@code civicdesk.store.poll-interval}, so rows inserted, changed or deleted
 * by other processes reach subscribers as well. The first scan is the replay.
 * Merges made through this adapter are also pushed in-process without waiting
 * for the next scan.</p>
 *
 * <p>Both feeds pass through a per-subscriber revision tracker: a row is
 * emitted as {@code ADDED} the first time it is seen and as {@code MODIFIED}
 * only when its revision grows, so a pushed merge and the scan that later
 * finds it yield one change.</p>
 */
@Component
public class R2dbcQueryStore implements QueryStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcQueryStore.class);

    private final QueryEntityRepository repository;
    private final DatabaseClient databaseClient;
    private final Duration pollInterval;
    private final Sinks.Many<QueryDocument> merged =
        Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);

    public R2dbcQueryStore(QueryEntityRepository repository, DatabaseClient databaseClient, EngineProperties properties) {
        this.repository = repository;
        this.databaseClient = databaseClient;
        this.pollInterval = properties.getStore().getPollInterval();
    }

    @Override
    public Flux<QueryDocumentChange> subscribe() {
        return Flux.defer(() -> {
            RevisionTracker tracker = new RevisionTracker();
            Flux<QueryDocumentChange> pushed = merged.asFlux()
                .<QueryDocumentChange>handle((document, sink) -> tracker.advance(document).ifPresent(sink::next));
            Flux<QueryDocumentChange> polled = Flux.interval(Duration.ZERO, pollInterval)
                .onBackpressureDrop()
                .concatMap(tick -> scan(tracker), 1);
            return Flux.merge(pushed, polled);
        });
    }

    /**
     * Reads every row once. Rows the tracker knew before the scan started but the
     * scan no longer finds are reported as removed.
     */
    private Flux<QueryDocumentChange> scan(RevisionTracker tracker) {
        return Flux.defer(() -> {
            Set<String> known = tracker.ids();
            Set<String> present = new HashSet<>();
            Flux<QueryDocumentChange> current = repository.findAll()
                .map(QueryEntity::toDocument)
                .doOnNext(document -> present.add(document.id()))
                .<QueryDocumentChange>handle((document, sink) -> tracker.advance(document).ifPresent(sink::next));
            Flux<QueryDocumentChange> removed = Flux.defer(() -> Flux.fromIterable(known)
                .filter(id -> !present.contains(id))
                .filter(tracker::forget)
                .map(id -> QueryDocumentChange.removed(new QueryDocument(id, Map.of()))));
            return current.concatWith(removed);
        }).onErrorResume(error -> {
            log.warn("Query table scan failed; retrying in {}: {}", pollInterval, error.getMessage());
            return Flux.empty();
        });
    }

    @Override
    public Mono<QueryDocument> get(String id) {
        return repository.findById(id)
            .map(QueryEntity::toDocument);
    }

    /**
     * Issues one {@code UPDATE} naming only the columns in {@code update}, then
     * reads the row back. Cleared fields are bound as typed {@code NULL}s.
     */
    @Override
    public Mono<QueryDocument> applyPartialUpdate(String id, QueryUpdate update, String actorId) {
        Map<QueryField, Object> values = update.values();
        String assignments = values.keySet().stream()
            .map(field -> "%s = :%s".formatted(field.column(), field.column()))
            .collect(Collectors.joining(", "));
        String sql = "UPDATE queries SET %s, revision = revision + 1 WHERE id = :id".formatted(assignments);

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql).bind("id", id);
        for (Map.Entry<QueryField, Object> entry : values.entrySet()) {
            spec = bind(spec, entry.getKey(), entry.getValue());
        }

        return spec.fetch().rowsUpdated()
            .flatMap(rows -> rows == 0 ? Mono.<QueryEntity>empty() : repository.findById(id))
            .map(QueryEntity::toDocument)
            .doOnNext(document -> {
                log.debug("Merged {} into query {} for {} (revision {})", update, id, actorId, document.revision());
                publish(document);
            });
    }

    private static DatabaseClient.GenericExecuteSpec bind(DatabaseClient.GenericExecuteSpec spec, QueryField field, Object value) {
        boolean temporal = field.type() == Instant.class;
        if (value == null) {
            return spec.bindNull(field.column(), temporal ? OffsetDateTime.class : String.class);
        }
        if (value instanceof Instant) {
            return spec.bind(field.column(), OffsetDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
        }
        return spec.bind(field.column(), value);
    }

    private synchronized void publish(QueryDocument document) {
        Sinks.EmitResult result = merged.tryEmitNext(document);
        if (result.isFailure()) {
            log.debug("No live subscriber took merge of query {}: {}", document.id(), result);
        }
    }

    /**
     * Highest revision a single subscriber has been sent, per query id.
     */
    private static final class RevisionTracker {

        private final ConcurrentMap<String, Long> revisions = new ConcurrentHashMap<>();

        Optional<QueryDocumentChange> advance(QueryDocument document) {
            AtomicReference<ChangeType> type = new AtomicReference<>();
            revisions.compute(document.id(), (id, held) -> {
                if (held == null) {
                    type.set(ChangeType.ADDED);
                    return document.revision();
                }
                if (document.revision() > held) {
                    type.set(ChangeType.MODIFIED);
                    return document.revision();
                }
                return held;
            });
            return Optional.ofNullable(type.get()).map(changeType -> new QueryDocumentChange(changeType, document));
        }

        Set<String> ids() {
            return Set.copyOf(revisions.keySet());
        }

        boolean forget(String id) {
            return revisions.remove(id) != null;
        }
    }
}
