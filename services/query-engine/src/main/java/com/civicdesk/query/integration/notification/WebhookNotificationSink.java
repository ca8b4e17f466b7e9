package com.civicdesk.query.integration.notification;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import com.civicdesk.query.config.EngineProperties;
import com.civicdesk.query.domain.AssignmentNotificationEvent;
import com.civicdesk.query.service.NotificationException;

import reactor.core.publisher.Mono;

/**
 * Relays assignment notifications to an HTTP endpoint as a flat JSON object,
 * with a link back to the query in the portal. One POST per event; any non-2xx
 * answer or I/O error is reported as {@link NotificationException}.
 */
@Component
@ConditionalOnProperty(prefix = "civicdesk.notifications", name = "channel", havingValue = "webhook")
public class WebhookNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSink.class);

    private final EngineProperties.WebhookProperties properties;
    private final EngineProperties.FrontendProperties frontendProperties;
    private final WebClient webClient;

    public WebhookNotificationSink(WebClient.Builder builder, EngineProperties engineProperties) {
        this.properties = engineProperties.getNotifications().getWebhook();
        this.frontendProperties = engineProperties.getFrontend();
        this.webClient = builder.build();
    }

    @Override
    public Mono<Void> publish(AssignmentNotificationEvent event) {
        if (!StringUtils.hasText(properties.getUrl())) {
            return Mono.error(new NotificationException("Webhook channel selected but civicdesk.notifications.webhook.url is empty"));
        }

        return webClient.post()
            .uri(properties.getUrl())
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> {
                if (StringUtils.hasText(properties.getToken())) {
                    headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken());
                }
            })
            .bodyValue(payload(event))
            .retrieve()
            .bodyToMono(String.class)
            .doOnNext(response -> log.debug("Notification webhook responded with: {}", response))
            .onErrorMap(error -> new NotificationException(
                "Webhook delivery for query %s failed: %s".formatted(event.queryId(), error.getMessage()), error))
            .then();
    }

    private Map<String, Object> payload(AssignmentNotificationEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", event.type());
        payload.put("recipientId", event.recipientId());
        payload.put("senderId", event.senderId());
        payload.put("senderName", event.senderName());
        payload.put("queryId", event.queryId());
        payload.put("queryTitle", event.queryTitle());
        payload.put("queryDescription", event.queryDescription());
        payload.put("read", event.read());
        payload.put("createdAt", event.createdAt().toString());
        payload.put("link", queryUrl(event.queryId()));
        return payload;
    }

    private String queryUrl(String queryId) {
        return "%s/admin/queries/%s".formatted(frontendProperties.getBaseUrl(), queryId);
    }
}
