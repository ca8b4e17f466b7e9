package com.civicdesk.query.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.civicdesk.query.config.EngineProperties;
import com.civicdesk.query.domain.Actor;
import com.civicdesk.query.domain.AssignmentNotificationEvent;
import com.civicdesk.query.domain.Query;
import com.civicdesk.query.domain.QueryAction;
import com.civicdesk.query.domain.QueryAssignment;
import com.civicdesk.query.domain.QueryStatus;
import com.civicdesk.query.domain.StaffRole;
import com.civicdesk.query.domain.StaffUser;
import com.civicdesk.query.integration.notification.NotificationSink;
import com.civicdesk.query.store.QueryUpdate;

import reactor.core.publisher.Mono;

/**
 * Routes queries to staff.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Restrict assignment to superadmins via {@link AccessPolicy}</li>
 *   <li>Write the assignment group and force the query to Active, whatever its prior status</li>
 *   <li>Tell the assignee through the {@link NotificationSink}</li>
 * </ul>
 * The assignment is the authoritative action: notification failures are logged
 * and never undo a committed assignment.</p>
 */
@Component
public class AssignmentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AssignmentCoordinator.class);

    private final AccessPolicy accessPolicy;
    private final StaffDirectory staffDirectory;
    private final QueryStoreClient storeClient;
    private final NotificationSink notificationSink;
    private final Clock clock;
    private final Duration timeout;

    public AssignmentCoordinator(
        AccessPolicy accessPolicy,
        StaffDirectory staffDirectory,
        QueryStoreClient storeClient,
        NotificationSink notificationSink,
        Clock clock,
        EngineProperties properties
    ) {
        this.accessPolicy = accessPolicy;
        this.staffDirectory = staffDirectory;
        this.storeClient = storeClient;
        this.notificationSink = notificationSink;
        this.clock = clock;
        this.timeout = properties.getStore().getTimeout();
    }

    public Mono<Query> assign(String queryId, String assigneeId, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.ASSIGN)
            .then(Mono.defer(() -> lookupAssignee(assigneeId)))
            .flatMap(assignee -> {
                Instant now = clock.instant();
                QueryUpdate update = QueryUpdate.builder()
                    .assignment(new QueryAssignment(assignee.id(), assignee.displayName(), actor.id(), now))
                    .status(QueryStatus.ACTIVE)
                    .clearResolution()
                    .touchedBy(actor.id(), now)
                    .build();
                return storeClient.write(queryId, update, actor.id())
                    .doOnNext(query -> log.info("Query {} assigned to {} by {}", queryId, assignee.id(), actor.id()))
                    .flatMap(query -> notifyAssignee(query, assignee, actor, now).thenReturn(query));
            });
    }

    /**
     * Staff members a superadmin can pick from, ordered by name.
     */
    public Mono<List<StaffUser>> listAssignableStaff(Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.ASSIGN)
            .thenMany(staffDirectory.findByRole(StaffRole.ADMIN))
            .timeout(timeout)
            .onErrorMap(error -> !(error instanceof QueryEngineException),
                error -> new PersistenceException("Staff directory lookup failed: " + error.getMessage(), error))
            .sort(Comparator.comparing(StaffUser::displayName, String.CASE_INSENSITIVE_ORDER))
            .collectList();
    }

    private Mono<StaffUser> lookupAssignee(String assigneeId) {
        if (assigneeId == null || assigneeId.isBlank()) {
            return Mono.error(new ValidationException("Assignee id is required"));
        }
        return staffDirectory.findById(assigneeId)
            .timeout(timeout)
            .onErrorMap(error -> !(error instanceof QueryEngineException),
                error -> new PersistenceException("Staff directory lookup failed: " + error.getMessage(), error))
            .switchIfEmpty(Mono.error(() -> new StaffUserNotFoundException(assigneeId)))
            .flatMap(assignee -> assignee.role() == StaffRole.USER
                ? Mono.error(new ValidationException("Staff user %s cannot be assigned queries".formatted(assigneeId)))
                : Mono.just(assignee));
    }

    private Mono<Void> notifyAssignee(Query query, StaffUser assignee, Actor actor, Instant now) {
        AssignmentNotificationEvent event = AssignmentNotificationEvent.forAssignment(query, assignee, actor, now);
        return notificationSink.publish(event)
            .timeout(timeout)
            .doOnSuccess(ignored -> log.debug("Assignment notification for query {} sent to {}", query.id(), assignee.id()))
            .doOnError(error -> log.warn("Failed to send assignment notification for query {} to {}: {}",
                query.id(), assignee.id(), error.getMessage()))
            .onErrorResume(error -> Mono.empty());
    }
}
