package com.civicdesk.query.web;

import java.security.Principal;
import java.time.Duration;

import org.springframework.stereotype.Component;

import com.civicdesk.query.config.EngineProperties;
import com.civicdesk.query.domain.Actor;
import com.civicdesk.query.service.AuthorizationException;
import com.civicdesk.query.service.PersistenceException;
import com.civicdesk.query.service.QueryEngineException;
import com.civicdesk.query.service.StaffDirectory;

import reactor.core.publisher.Mono;

/**
 * Turns the authenticated principal into an {@link Actor} by looking its name
 * (the token subject) up in the staff directory.
 */
@Component
public class ActorResolver {

    private final StaffDirectory staffDirectory;
    private final Duration timeout;

    public ActorResolver(StaffDirectory staffDirectory, EngineProperties properties) {
        this.staffDirectory = staffDirectory;
        this.timeout = properties.getStore().getTimeout();
    }

    public Mono<Actor> resolve(Principal principal) {
        if (principal == null) {
            return Mono.error(new AuthorizationException("Anonymous callers cannot access queries"));
        }
        String accountId = principal.getName();
        return staffDirectory.findById(accountId)
            .timeout(timeout)
            .onErrorMap(error -> !(error instanceof QueryEngineException),
                error -> new PersistenceException("Staff directory lookup failed: " + error.getMessage(), error))
            .switchIfEmpty(Mono.error(() -> new AuthorizationException("No staff account for principal " + accountId)))
            .map(Actor::of);
    }
}
