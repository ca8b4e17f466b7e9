package com.civicdesk.query.service;

import com.civicdesk.query.domain.StaffRole;
import com.civicdesk.query.domain.StaffUser;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only lookup of portal accounts and their roles. Account management lives
 * with the authentication provider; the engine never writes here.
 */
public interface StaffDirectory {

    /**
     * @return the account, or an empty {@link Mono} when the id is unknown
     */
    Mono<StaffUser> findById(String id);

    Flux<StaffUser> findByRole(StaffRole role);
}
