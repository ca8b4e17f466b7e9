package com.civicdesk.query.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface NotificationRepository extends ReactiveCrudRepository<NotificationEntity, Long> {

    Flux<NotificationEntity> findByRecipientId(String recipientId);
}
