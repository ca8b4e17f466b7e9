package com.civicdesk.query.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence and push-subscription gateway for query documents.
 *
 * <p>Implementations own the wire format; the engine only relies on the
 * contract below.</p>
 */
public interface QueryStore {

    /**
     * Opens a long-lived subscription to the whole query collection. The complete
     * current set is replayed as {@code ADDED} changes first, then every later
     * change is delivered with the full current document, whichever process
     * made it. Documents carry the store revision they were read at.
     */
    Flux<QueryDocumentChange> subscribe();

    /**
     * @return the document, or an empty {@link Mono} when no such id exists
     */
    Mono<QueryDocument> get(String id);

    /**
     * Merges only the fields named in {@code update} into the stored document and
     * returns the merged result. Fields not named are never overwritten, so two
     * commands touching different field groups of the same query do not clobber
     * each other. The write is all-or-nothing and advances the document revision.
     *
     * @return the merged document, or an empty {@link Mono} when no such id exists
     */
    Mono<QueryDocument> applyPartialUpdate(String id, QueryUpdate update, String actorId);
}
