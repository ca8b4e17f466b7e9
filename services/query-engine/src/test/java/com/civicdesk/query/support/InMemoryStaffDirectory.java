package com.civicdesk.query.support;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.civicdesk.query.domain.StaffRole;
import com.civicdesk.query.domain.StaffUser;
import com.civicdesk.query.service.StaffDirectory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class InMemoryStaffDirectory implements StaffDirectory {

    private final Map<String, StaffUser> users = new ConcurrentHashMap<>();

    public InMemoryStaffDirectory add(StaffUser user) {
        users.put(user.id(), user);
        return this;
    }

    @Override
    public Mono<StaffUser> findById(String id) {
        return Mono.justOrEmpty(users.get(id));
    }

    @Override
    public Flux<StaffUser> findByRole(StaffRole role) {
        return Flux.fromIterable(users.values()).filter(user -> user.role() == role);
    }
}
