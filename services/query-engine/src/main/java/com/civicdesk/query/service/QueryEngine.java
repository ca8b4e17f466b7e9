package com.civicdesk.query.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import com.civicdesk.query.config.EngineProperties;
import com.civicdesk.query.domain.Actor;
import com.civicdesk.query.domain.ChangeType;
import com.civicdesk.query.domain.MetricsSeries;
import com.civicdesk.query.domain.MetricsWindow;
import com.civicdesk.query.domain.PendingResolution;
import com.civicdesk.query.domain.Query;
import com.civicdesk.query.domain.QueryAction;
import com.civicdesk.query.domain.QueryChangeEvent;
import com.civicdesk.query.domain.QueryFilter;
import com.civicdesk.query.domain.QueryStatus;
import com.civicdesk.query.domain.StaffUser;
import com.civicdesk.query.domain.StatusSummary;
import com.civicdesk.query.store.InvalidQueryDocumentException;
import com.civicdesk.query.store.QueryDocumentChange;
import com.civicdesk.query.store.QueryDocumentMapper;
import com.civicdesk.query.store.QueryStore;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point of the query lifecycle engine.
 *
 * <p>The engine owns exactly one subscription to the query store. Store changes
 * are folded, one at a time on a dedicated thread, into an immutable
 * {@link QuerySnapshot}; each new snapshot is published to a replay-latest sink
 * that feeds the change stream and the metrics stream. Commands are independent
 * reactive tasks that write through the store and never wait on the
 * subscription.</p>
 *
 * <p>Metrics are recomputed whenever the snapshot or the selected window
 * changes. A newer trigger cancels the computation in flight, so only the most
 * recent series is ever emitted.</p>
 */
@Service
public class QueryEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final QueryStore queryStore;
    private final QueryDocumentMapper mapper;
    private final QueryStoreClient storeClient;
    private final AccessPolicy accessPolicy;
    private final LifecycleStateMachine lifecycle;
    private final AssignmentCoordinator assignments;
    private final MetricsAggregator aggregator;
    private final Clock clock;
    private final ZoneId zone;

    private final Sinks.Many<QuerySnapshot> snapshots = Sinks.many().replay().latest();
    private final Sinks.Many<MetricsWindow> windows = Sinks.many().replay().latest();

    private volatile QuerySnapshot snapshot = QuerySnapshot.EMPTY;
    private volatile MetricsWindow selectedWindow;
    private volatile Disposable subscription;
    private volatile Scheduler subscriptionScheduler;

    public QueryEngine(
        QueryStore queryStore,
        QueryDocumentMapper mapper,
        QueryStoreClient storeClient,
        AccessPolicy accessPolicy,
        LifecycleStateMachine lifecycle,
        AssignmentCoordinator assignments,
        MetricsAggregator aggregator,
        Clock clock,
        ZoneId zone,
        EngineProperties properties
    ) {
        this.queryStore = queryStore;
        this.mapper = mapper;
        this.storeClient = storeClient;
        this.accessPolicy = accessPolicy;
        this.lifecycle = lifecycle;
        this.assignments = assignments;
        this.aggregator = aggregator;
        this.clock = clock;
        this.zone = zone;
        this.selectedWindow = MetricsWindow.fromLabel(properties.getMetrics().getDefaultWindow());
        snapshots.tryEmitNext(QuerySnapshot.EMPTY);
        windows.tryEmitNext(selectedWindow);
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        subscriptionScheduler = Schedulers.newSingle("query-subscription");
        subscription = queryStore.subscribe()
            .publishOn(subscriptionScheduler)
            .subscribe(
                this::apply,
                error -> log.error("Query subscription failed; keeping last snapshot of {} queries", snapshot.size(), error),
                () -> log.warn("Query subscription completed by the store; snapshot frozen at {} queries", snapshot.size()));
        log.info("Query subscription opened");
    }

    @Override
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
        if (subscriptionScheduler != null) {
            subscriptionScheduler.dispose();
            subscriptionScheduler = null;
        }
        log.info("Query subscription closed");
    }

    @Override
    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    // --- live state ---------------------------------------------------------------------------

    public QuerySnapshot currentSnapshot() {
        return snapshot;
    }

    public Flux<QuerySnapshot> snapshots() {
        return snapshots.asFlux();
    }

    /**
     * Typed change stream: the current query set as {@code ADDED} events, then every
     * later delta. Each subscriber diffs consecutive snapshots, so a slow subscriber
     * may see coalesced changes but never a gap.
     */
    public Flux<QueryChangeEvent> subscribeQueries() {
        return Flux.defer(() -> {
            AtomicReference<QuerySnapshot> previous = new AtomicReference<>(QuerySnapshot.EMPTY);
            return snapshots.asFlux()
                .concatMapIterable(current -> current.changesSince(previous.getAndSet(current)));
        });
    }

    public Flux<QueryChangeEvent> subscribeQueries(Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.VIEW).thenMany(subscribeQueries());
    }

    public Mono<List<Query>> listQueries(QueryFilter filter, Actor actor) {
        QueryFilter effective = filter == null ? QueryFilter.ALL : filter;
        return accessPolicy.authorize(actor, QueryAction.VIEW)
            .map(authorized -> snapshot.queries().stream()
                .filter(effective::matches)
                .sorted(Comparator.comparing(Query::submissionDate).reversed())
                .collect(Collectors.toList()));
    }

    public Mono<Query> getQuery(String queryId, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.VIEW)
            .then(Mono.defer(() -> snapshot.find(queryId)
                .map(Mono::just)
                .orElseGet(() -> storeClient.fetch(queryId))));
    }

    public Mono<StatusSummary> summary(Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.VIEW)
            .map(authorized -> aggregator.summarize(snapshot.queries()));
    }

    // --- commands -----------------------------------------------------------------------------

    public Mono<Query> assignQuery(String queryId, String assigneeId, Actor actor) {
        return assignments.assign(queryId, assigneeId, actor);
    }

    public Mono<List<StaffUser>> listAssignableStaff(Actor actor) {
        return assignments.listAssignableStaff(actor);
    }

    public Mono<Query> changeStatus(String queryId, QueryStatus status, Actor actor) {
        return lifecycle.changeStatus(queryId, status, actor);
    }

    /**
     * Variant taking the raw status label; unknown labels fail with {@link ValidationException}.
     */
    public Mono<Query> changeStatus(String queryId, String status, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.CHANGE_STATUS)
            .then(Mono.defer(() -> lifecycle.changeStatus(queryId, QueryStatus.fromValue(status), actor)));
    }

    public Mono<PendingResolution> proposeResolution(String queryId, Actor actor) {
        return lifecycle.proposeResolution(queryId, actor);
    }

    public Mono<Query> commitResolution(String queryId, String message, Actor actor) {
        return lifecycle.commitResolution(queryId, message, actor);
    }

    public Mono<Void> cancelResolution(String queryId, Actor actor) {
        return lifecycle.cancelResolution(queryId, actor);
    }

    // --- metrics ------------------------------------------------------------------------------

    public MetricsSeries computeMetrics(QuerySnapshot source, int windowDays) {
        return computeMetrics(source, MetricsWindow.ofDays(windowDays));
    }

    public MetricsSeries computeMetrics(QuerySnapshot source, MetricsWindow window) {
        return aggregator.compute(source.queries(), window, LocalDate.now(clock.withZone(zone)));
    }

    public Mono<MetricsSeries> metrics(MetricsWindow window, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.VIEW)
            .map(authorized -> computeMetrics(snapshot, window));
    }

    public MetricsWindow selectedWindow() {
        return selectedWindow;
    }

    public synchronized void selectWindow(MetricsWindow window) {
        selectedWindow = window;
        Sinks.EmitResult result = windows.tryEmitNext(window);
        if (result.isFailure()) {
            log.warn("Could not publish metrics window {}: {}", window.label(), result);
        }
    }

    public Mono<MetricsWindow> selectWindow(MetricsWindow window, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.VIEW)
            .map(authorized -> {
                selectWindow(window);
                log.info("Metrics window set to {} by {}", window.label(), actor.id());
                return window;
            });
    }

    /**
     * Metrics for the engine-wide window selection (see {@link #selectWindow}).
     */
    public Flux<MetricsSeries> metrics() {
        return metrics(windows.asFlux());
    }

    public Flux<MetricsSeries> metrics(Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.VIEW).thenMany(metrics());
    }

    /**
     * Recomputes the series whenever the snapshot or the selected window changes.
     * A computation still running when the next trigger arrives is cancelled and
     * its result discarded.
     */
    public Flux<MetricsSeries> metrics(Flux<MetricsWindow> windowSelections) {
        return Flux.combineLatest(snapshots.asFlux(), windowSelections.distinctUntilChanged(), MetricsTrigger::new)
            .switchMap(trigger -> Mono.fromCallable(() -> computeMetrics(trigger.snapshot(), trigger.window()))
                .subscribeOn(Schedulers.boundedElastic()));
    }

    public Flux<MetricsSeries> metrics(Flux<MetricsWindow> windowSelections, Actor actor) {
        return accessPolicy.authorize(actor, QueryAction.VIEW).thenMany(metrics(windowSelections));
    }

    // --- subscription handling ----------------------------------------------------------------

    private void apply(QueryDocumentChange change) {
        String id = change.document().id();
        QuerySnapshot next;
        if (change.type() == ChangeType.REMOVED) {
            next = snapshot.remove(id);
        } else {
            try {
                next = snapshot.upsert(mapper.toQuery(change.document()), change.document().revision());
            } catch (InvalidQueryDocumentException e) {
                log.warn("{}", e.getMessage());
                next = snapshot.reject(id, change.document().revision());
            }
        }
        if (next == snapshot) {
            log.debug("Ignored stale {} change for query {}", change.type(), id);
            return;
        }
        snapshot = next;
        Sinks.EmitResult result = snapshots.tryEmitNext(next);
        if (result.isFailure()) {
            log.warn("Could not publish snapshot version {}: {}", next.version(), result);
        }
        log.debug("Applied {} change for query {} (snapshot version {}, {} queries)",
            change.type(), id, next.version(), next.size());
    }

    private record MetricsTrigger(QuerySnapshot snapshot, MetricsWindow window) {
    }
}
