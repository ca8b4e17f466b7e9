package com.civicdesk.query.service;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.civicdesk.query.config.EngineProperties;
import com.civicdesk.query.domain.Query;
import com.civicdesk.query.store.InvalidQueryDocumentException;
import com.civicdesk.query.store.QueryDocument;
import com.civicdesk.query.store.QueryDocumentMapper;
import com.civicdesk.query.store.QueryStore;
import com.civicdesk.query.store.QueryUpdate;

import reactor.core.publisher.Mono;

/**
 * Typed, time-bounded access to the {@link QueryStore} for commands. Every call
 * is cut off after {@code civicdesk.store.timeout}; timeouts and store failures
 * surface as {@link PersistenceException}, absent ids as
 * {@link QueryNotFoundException}.
 *
 * <p>The write timeout spans the merge and its read-back, so a write that times
 * out may still have been committed. Such a failure is reported as of unknown
 * outcome; the subscription delivers the row as stored either way.</p>
 */
@Component
public class QueryStoreClient {

    private static final Logger log = LoggerFactory.getLogger(QueryStoreClient.class);

    private final QueryStore queryStore;
    private final QueryDocumentMapper mapper;
    private final Duration timeout;

    public QueryStoreClient(QueryStore queryStore, QueryDocumentMapper mapper, EngineProperties properties) {
        this.queryStore = queryStore;
        this.mapper = mapper;
        this.timeout = properties.getStore().getTimeout();
    }

    public Mono<Query> fetch(String id) {
        return bounded(queryStore.get(id), "read", id)
            .switchIfEmpty(Mono.error(() -> new QueryNotFoundException(id)))
            .map(mapper::toQuery)
            .onErrorMap(InvalidQueryDocumentException.class,
                e -> new PersistenceException("Store returned an invalid document for query " + id, e));
    }

    public Mono<Query> write(String id, QueryUpdate update, String actorId) {
        Mono<QueryDocument> merge = queryStore.applyPartialUpdate(id, update, actorId)
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> {
                log.warn("Write to query {} by {} timed out after {}; it may or may not have been applied", id, actorId, timeout);
                return new PersistenceException("Query store write for query %s timed out after %s; outcome unknown"
                    .formatted(id, timeout), e);
            });
        return asPersistenceFailure(merge, "write", id)
            .switchIfEmpty(Mono.error(() -> new QueryNotFoundException(id)))
            .map(mapper::toQuery)
            .onErrorMap(InvalidQueryDocumentException.class,
                e -> new PersistenceException("Store returned an invalid document for query " + id, e));
    }

    private <T> Mono<T> bounded(Mono<T> call, String operation, String id) {
        return asPersistenceFailure(call.timeout(timeout), operation, id);
    }

    private static <T> Mono<T> asPersistenceFailure(Mono<T> call, String operation, String id) {
        return call
            .onErrorMap(error -> !(error instanceof QueryEngineException),
                error -> new PersistenceException("Query store %s failed for query %s: %s"
                    .formatted(operation, id, error.getMessage()), error));
    }
}
