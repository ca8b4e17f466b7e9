package com.civicdesk.query.integration.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.civicdesk.query.domain.AssignmentNotificationEvent;
import com.civicdesk.query.repository.NotificationEntity;
import com.civicdesk.query.repository.NotificationRepository;
import com.civicdesk.query.service.NotificationException;

import reactor.core.publisher.Mono;

/**
 * Stores assignment notifications in the {@code notifications} table, where the
 * portal's notification bell picks them up. A notification only counts as
 * delivered once it can be read back.
 */
@Component
@ConditionalOnProperty(prefix = "civicdesk.notifications", name = "channel", havingValue = "inbox", matchIfMissing = true)
public class InboxNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(InboxNotificationSink.class);

    private final NotificationRepository repository;

    public InboxNotificationSink(NotificationRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<Void> publish(AssignmentNotificationEvent event) {
        return repository.save(NotificationEntity.from(event))
            .flatMap(saved -> repository.findById(saved.getId())
                .switchIfEmpty(Mono.error(() -> new NotificationException(
                    "Notification %d for query %s could not be read back".formatted(saved.getId(), event.queryId())))))
            .doOnNext(stored -> log.debug("Stored notification {} for recipient {}", stored.getId(), stored.getRecipientId()))
            .onErrorMap(error -> !(error instanceof NotificationException),
                error -> new NotificationException("Failed to store notification for query " + event.queryId(), error))
            .then();
    }
}
