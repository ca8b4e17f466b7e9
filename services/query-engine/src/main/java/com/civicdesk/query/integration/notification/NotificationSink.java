package com.civicdesk.query.integration.notification;

import com.civicdesk.query.domain.AssignmentNotificationEvent;

import reactor.core.publisher.Mono;

/**
 * Fire-and-forget delivery of assignment notifications. One attempt per event;
 * failures are signalled as {@link com.civicdesk.query.service.NotificationException}.
 */
public interface NotificationSink {

    Mono<Void> publish(AssignmentNotificationEvent event);
}
