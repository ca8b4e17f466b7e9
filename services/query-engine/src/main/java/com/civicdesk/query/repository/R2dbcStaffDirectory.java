package com.civicdesk.query.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.civicdesk.query.domain.StaffRole;
import com.civicdesk.query.domain.StaffUser;
import com.civicdesk.query.service.StaffDirectory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link StaffDirectory} backed by the {@code staff_users} table. Rows with a
 * role this service does not know are treated as plain users, which grants
 * them nothing.
 */
@Component
public class R2dbcStaffDirectory implements StaffDirectory {

    private static final Logger log = LoggerFactory.getLogger(R2dbcStaffDirectory.class);

    private final StaffUserRepository repository;

    public R2dbcStaffDirectory(StaffUserRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<StaffUser> findById(String id) {
        return repository.findById(id).map(this::toStaffUser);
    }

    @Override
    public Flux<StaffUser> findByRole(StaffRole role) {
        return repository.findByRole(role.value()).map(this::toStaffUser);
    }

    private StaffUser toStaffUser(StaffUserEntity entity) {
        StaffRole role = StaffRole.fromValue(entity.getRole()).orElseGet(() -> {
            log.warn("Staff user {} has unknown role '{}'; treating as {}", entity.getId(), entity.getRole(), StaffRole.USER.value());
            return StaffRole.USER;
        });
        return new StaffUser(entity.getId(), entity.getName(), entity.getEmail(), entity.getDepartment(), role);
    }
}
