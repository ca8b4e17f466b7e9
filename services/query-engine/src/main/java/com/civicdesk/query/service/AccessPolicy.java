package com.civicdesk.query.service;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.civicdesk.query.domain.Actor;
import com.civicdesk.query.domain.QueryAction;
import com.civicdesk.query.domain.StaffRole;

import reactor.core.publisher.Mono;

/**
 * Role-based capability table for query operations.
 *
 * <p>Admins and superadmins may view queries, move them between Open and
 * Active and resolve them; only superadmins may assign or reassign. Customer
 * accounts ({@link StaffRole#USER}) have no capabilities here.</p>
 */
@Component
public class AccessPolicy {

    private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

    private static final Map<QueryAction, Set<StaffRole>> CAPABILITIES = new EnumMap<>(QueryAction.class);

    static {
        Set<StaffRole> staff = EnumSet.of(StaffRole.ADMIN, StaffRole.SUPERADMIN);
        CAPABILITIES.put(QueryAction.VIEW, staff);
        CAPABILITIES.put(QueryAction.CHANGE_STATUS, staff);
        CAPABILITIES.put(QueryAction.RESOLVE, staff);
        CAPABILITIES.put(QueryAction.ASSIGN, EnumSet.of(StaffRole.SUPERADMIN));
    }

    public boolean isAllowed(StaffRole role, QueryAction action) {
        return role != null && CAPABILITIES.getOrDefault(action, Set.of()).contains(role);
    }

    /**
     * Completes with the actor when allowed, otherwise fails with
     * {@link AuthorizationException}. Evaluated lazily on subscription so it can
     * head a reactive command chain.
     */
    public Mono<Actor> authorize(Actor actor, QueryAction action) {
        return Mono.fromCallable(() -> {
            check(actor, action);
            return actor;
        });
    }

    public void check(Actor actor, QueryAction action) {
        if (actor == null) {
            throw new AuthorizationException("Anonymous callers cannot access queries");
        }
        if (!isAllowed(actor.role(), action)) {
            log.warn("Denied {} for actor {} with role {}", action, actor.id(), actor.role().value());
            throw new AuthorizationException(actor.id(), action);
        }
    }
}
