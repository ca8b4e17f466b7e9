package com.civicdesk.query.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.civicdesk.query.config.EngineProperties;
import com.civicdesk.query.domain.Actor;
import com.civicdesk.query.domain.PendingResolution;
import com.civicdesk.query.domain.Query;
import com.civicdesk.query.domain.QueryAction;
import com.civicdesk.query.domain.QueryResolution;
import com.civicdesk.query.domain.QueryStatus;
import com.civicdesk.query.store.QueryUpdate;

import reactor.core.publisher.Mono;

/**
 * Status transitions of a query.
 *
 * <p>Open and Active are set directly. Resolving is two-phase: a caller first
 * proposes the resolution (nothing is written), then commits it with a
 * non-blank message, or cancels. Resolved is not terminal; moving a resolved
 * query back to Open or Active drops its resolution details in the same
 * write.</p>
 *
 * <p>Proposals live in memory only. They are dropped once the query's status
 * changes through this engine, and expire after
 * {@code civicdesk.lifecycle.proposal-ttl} otherwise.</p>
 */
@Component
public class LifecycleStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LifecycleStateMachine.class);

    private final AccessPolicy accessPolicy;
    private final QueryStoreClient storeClient;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration proposalTtl;
    private final ConcurrentMap<PendingKey, PendingResolution> pending = new ConcurrentHashMap<>();

    public LifecycleStateMachine(AccessPolicy accessPolicy, QueryStoreClient storeClient, Clock clock, ZoneId zone,
                                 EngineProperties properties) {
        this.accessPolicy = accessPolicy;
        this.storeClient = storeClient;
        this.clock = clock;
        this.zone = zone;
        this.proposalTtl = properties.getLifecycle().getProposalTtl();
    }

    /**
     * Moves a query to Open or Active. Resolved is rejected here because it needs
     * a resolution message; use {@link #proposeResolution} and {@link #commitResolution}.
     */
    public Mono<Query> changeStatus(String queryId, QueryStatus target, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.CHANGE_STATUS)
            .flatMap(authorized -> {
                if (target == null) {
                    return Mono.error(new ValidationException("Target status is required"));
                }
                if (target == QueryStatus.RESOLVED) {
                    return Mono.error(new ValidationException(
                        "Resolving a query requires a resolution message; propose and commit a resolution instead"));
                }
                QueryUpdate update = QueryUpdate.builder()
                    .status(target)
                    .clearResolution()
                    .touchedBy(actor.id(), clock.instant())
                    .build();
                return storeClient.write(queryId, update, actor.id());
            })
            .doOnNext(query -> {
                dropProposals(queryId);
                log.info("Query {} moved to {} by {}", queryId, target.value(), actor.id());
            });
    }

    /**
     * Registers the intent to resolve a query without touching the store.
     */
    public Mono<PendingResolution> proposeResolution(String queryId, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.RESOLVE)
            .then(Mono.defer(() -> storeClient.fetch(queryId)))
            .map(query -> {
                evictExpired();
                PendingResolution proposal = new PendingResolution(
                    query.id(), query.referenceId(), query.status(), actor.id(), clock.instant());
                pending.put(new PendingKey(queryId, actor.id()), proposal);
                log.debug("Resolution proposed for query {} by {}", queryId, actor.id());
                return proposal;
            });
    }

    /**
     * Resolves a query. The message is checked before any I/O, so a blank
     * message leaves the query exactly as it was. A prior proposal is not required.
     */
    public Mono<Query> commitResolution(String queryId, String message, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.RESOLVE)
            .flatMap(authorized -> {
                if (message == null || message.isBlank()) {
                    return Mono.error(new ValidationException("Resolution message must not be blank"));
                }
                Instant now = clock.instant();
                QueryResolution resolution = new QueryResolution(message.trim(), startOfDay(now), actor.displayName());
                QueryUpdate update = QueryUpdate.builder()
                    .status(QueryStatus.RESOLVED)
                    .resolution(resolution)
                    .touchedBy(actor.id(), now)
                    .build();
                return storeClient.write(queryId, update, actor.id());
            })
            .doOnNext(query -> {
                dropProposals(queryId);
                log.info("Query {} resolved by {}", queryId, actor.id());
            });
    }

    /**
     * Drops a pending resolution. Never writes to the store.
     */
    public Mono<Void> cancelResolution(String queryId, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.RESOLVE)
            .doOnNext(authorized -> {
                if (pending.remove(new PendingKey(queryId, actor.id())) != null) {
                    log.debug("Resolution of query {} cancelled by {}", queryId, actor.id());
                }
            })
            .then();
    }

    public Optional<PendingResolution> pendingResolution(String queryId, String actorId) {
        evictExpired();
        return Optional.ofNullable(pending.get(new PendingKey(queryId, actorId)));
    }

    int pendingCount() {
        return pending.size();
    }

    private void dropProposals(String queryId) {
        pending.keySet().removeIf(key -> key.queryId().equals(queryId));
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(proposalTtl);
        pending.values().removeIf(proposal -> {
            boolean expired = proposal.proposedAt().isBefore(cutoff);
            if (expired) {
                log.debug("Resolution proposal for query {} by {} expired", proposal.queryId(), proposal.proposedBy());
            }
            return expired;
        });
    }

    /**
     * Midnight at the start of the day containing {@code instant}, in the engine zone.
     */
    Instant startOfDay(Instant instant) {
        LocalDate day = instant.atZone(zone).toLocalDate();
        return day.atStartOfDay(zone).toInstant();
    }

    private record PendingKey(String queryId, String actorId) {
    }
}
