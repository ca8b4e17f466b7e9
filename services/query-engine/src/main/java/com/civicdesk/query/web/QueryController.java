package com.civicdesk.query.web;

import java.security.Principal;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.civicdesk.query.domain.MetricsSeries;
import com.civicdesk.query.domain.MetricsWindow;
import com.civicdesk.query.domain.PendingResolution;
import com.civicdesk.query.domain.QueryFilter;
import com.civicdesk.query.domain.QueryStatus;
import com.civicdesk.query.domain.StatusSummary;
import com.civicdesk.query.service.QueryEngine;
import com.civicdesk.query.web.dto.AssignmentRequest;
import com.civicdesk.query.web.dto.QueryChangeResponse;
import com.civicdesk.query.web.dto.QueryResponse;
import com.civicdesk.query.web.dto.ResolutionRequest;
import com.civicdesk.query.web.dto.StatusChangeRequest;
import com.civicdesk.query.web.dto.WindowSelectionRequest;

import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP API exposed to the admin portal. All endpoints are reactive; the stream
 * endpoints keep the connection open and push live changes as server-sent events.
 *
 * <p>Authentication is enforced here, role checks inside the engine.</p>
 */
@RestController
@RequestMapping(path = "/api/queries", produces = MediaType.APPLICATION_JSON_VALUE)
@PreAuthorize("isAuthenticated()")
public class QueryController {

    private final QueryEngine queryEngine;
    private final ActorResolver actorResolver;
    private final QueryMapper queryMapper;

    public QueryController(QueryEngine queryEngine, ActorResolver actorResolver, QueryMapper queryMapper) {
        this.queryEngine = queryEngine;
        this.actorResolver = actorResolver;
        this.queryMapper = queryMapper;
    }

    @GetMapping
    public Flux<QueryResponse> listQueries(
        @RequestParam(required = false) String status,
        @RequestParam(required = false) String search,
        Principal principal
    ) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.listQueries(filter(status, search), actor))
            .flatMapIterable(queries -> queries)
            .map(queryMapper::toResponse);
    }

    @GetMapping("/{id}")
    public Mono<QueryResponse> getQuery(@PathVariable String id, Principal principal) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.getQuery(id, actor))
            .map(queryMapper::toResponse);
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<QueryChangeResponse>> streamQueries(Principal principal) {
        return actorResolver.resolve(principal)
            .flatMapMany(queryEngine::subscribeQueries)
            .map(queryMapper::toResponse)
            .map(change -> ServerSentEvent.builder(change)
                .event(change.type().name())
                .id(change.query().id())
                .build());
    }

    @PutMapping(path = "/{id}/assignment", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryResponse> assignQuery(
        @PathVariable String id,
        @Valid @RequestBody AssignmentRequest request,
        Principal principal
    ) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.assignQuery(id, request.getAssigneeId(), actor))
            .map(queryMapper::toResponse);
    }

    @PutMapping(path = "/{id}/status", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryResponse> changeStatus(
        @PathVariable String id,
        @Valid @RequestBody StatusChangeRequest request,
        Principal principal
    ) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.changeStatus(id, request.getStatus(), actor))
            .map(queryMapper::toResponse);
    }

    @PostMapping("/{id}/resolution/proposal")
    public Mono<PendingResolution> proposeResolution(@PathVariable String id, Principal principal) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.proposeResolution(id, actor));
    }

    @DeleteMapping("/{id}/resolution/proposal")
    public Mono<ResponseEntity<Void>> cancelResolution(@PathVariable String id, Principal principal) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.cancelResolution(id, actor))
            .then(Mono.fromCallable(() -> ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping(path = "/{id}/resolution", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryResponse> commitResolution(
        @PathVariable String id,
        @Valid @RequestBody ResolutionRequest request,
        Principal principal
    ) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.commitResolution(id, request.getMessage(), actor))
            .map(queryMapper::toResponse);
    }

    @GetMapping("/metrics")
    public Mono<MetricsSeries> metrics(@RequestParam(required = false) String window, Principal principal) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.metrics(window(window), actor));
    }

    /**
     * Without a {@code window} parameter the stream follows the shared selection
     * and re-emits whenever it changes through {@code PUT /metrics/window}.
     */
    @GetMapping(path = "/metrics/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<MetricsSeries> streamMetrics(@RequestParam(required = false) String window, Principal principal) {
        return actorResolver.resolve(principal)
            .flatMapMany(actor -> window == null || window.isBlank()
                ? queryEngine.metrics(actor)
                : queryEngine.metrics(Flux.just(MetricsWindow.fromLabel(window)), actor));
    }

    @PutMapping(path = "/metrics/window", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<MetricsSeries> selectWindow(@Valid @RequestBody WindowSelectionRequest request, Principal principal) {
        return actorResolver.resolve(principal)
            .flatMap(actor -> queryEngine.selectWindow(MetricsWindow.fromLabel(request.getWindow()), actor)
                .flatMap(selected -> queryEngine.metrics(selected, actor)));
    }

    @GetMapping("/summary")
    public Mono<StatusSummary> summary(Principal principal) {
        return actorResolver.resolve(principal)
            .flatMap(queryEngine::summary);
    }

    private static QueryFilter filter(String status, String search) {
        QueryStatus parsed = status == null || status.isBlank() || "all".equalsIgnoreCase(status.trim())
            ? null
            : QueryStatus.fromValue(status);
        return new QueryFilter(parsed, search);
    }

    private MetricsWindow window(String label) {
        return label == null || label.isBlank() ? queryEngine.selectedWindow() : MetricsWindow.fromLabel(label);
    }
}
