package com.civicdesk.query.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface StaffUserRepository extends ReactiveCrudRepository<StaffUserEntity, String> {

    Flux<StaffUserEntity> findByRole(String role);
}
