package com.civicdesk.query.web;

import java.security.Principal;

import org.springframework.http.MediaType;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.civicdesk.query.service.QueryEngine;
import com.civicdesk.query.web.dto.StaffResponse;

import reactor.core.publisher.Flux;

/**
 * Staff lookups needed by the assignment dialog.
 */
@RestController
@RequestMapping(path = "/api/staff", produces = MediaType.APPLICATION_JSON_VALUE)
@PreAuthorize("isAuthenticated()")
public class StaffController {

    private final QueryEngine queryEngine;
    private final ActorResolver actorResolver;
    private final QueryMapper queryMapper;

    public StaffController(QueryEngine queryEngine, ActorResolver actorResolver, QueryMapper queryMapper) {
        this.queryEngine = queryEngine;
        this.actorResolver = actorResolver;
        this.queryMapper = queryMapper;
    }

    @GetMapping("/assignable")
    public Flux<StaffResponse> assignableStaff(Principal principal) {
        return actorResolver.resolve(principal)
            .flatMap(queryEngine::listAssignableStaff)
            .flatMapIterable(staff -> staff)
            .map(queryMapper::toResponse);
    }
}
