package com.civicdesk.query.integration.notification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import com.civicdesk.query.config.EngineProperties;
import com.civicdesk.query.domain.AssignmentNotificationEvent;
import com.civicdesk.query.service.NotificationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import reactor.test.StepVerifier;

@DisplayName("Webhook notification sink")
class WebhookNotificationSinkTest {

    private static final AssignmentNotificationEvent EVENT = new AssignmentNotificationEvent(
        AssignmentNotificationEvent.QUERY_ASSIGNMENT, "ad-1", "sa-1", "Sipho Dlamini",
        "q-1", "QRY-001", "Water meter reading looks wrong", false, Instant.parse("2024-03-01T10:15:00Z"));

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer hookServer;
    private EngineProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        hookServer = new MockWebServer();
        hookServer.start();
        properties = new EngineProperties();
        properties.getNotifications().setChannel("webhook");
        properties.getNotifications().getWebhook().setUrl(hookServer.url("/hooks/query-assignments").toString());
        properties.getFrontend().setBaseUrl("https://portal.example.org");
    }

    @AfterEach
    void tearDown() throws IOException {
        hookServer.shutdown();
    }

    private WebhookNotificationSink sink() {
        return new WebhookNotificationSink(WebClient.builder(), properties);
    }

    @Test
    @DisplayName("posts the event as flat JSON with a link to the query")
    void postsPayload() throws Exception {
        hookServer.enqueue(new MockResponse().setResponseCode(202).setBody("{\"ok\":true}"));

        StepVerifier.create(sink().publish(EVENT)).verifyComplete();

        RecordedRequest request = hookServer.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks/query-assignments");
        assertThat(request.getHeader(HttpHeaders.CONTENT_TYPE)).startsWith("application/json");
        assertThat(request.getHeader(HttpHeaders.AUTHORIZATION)).isNull();

        Map<String, Object> body = objectMapper.readValue(request.getBody().readUtf8(), new TypeReference<>() { });
        assertThat(body)
            .containsEntry("type", "QUERY_ASSIGNMENT")
            .containsEntry("recipientId", "ad-1")
            .containsEntry("senderName", "Sipho Dlamini")
            .containsEntry("queryTitle", "QRY-001")
            .containsEntry("read", false)
            .containsEntry("createdAt", "2024-03-01T10:15:00Z")
            .containsEntry("link", "https://portal.example.org/admin/queries/q-1");
    }

    @Test
    @DisplayName("sends the configured bearer token")
    void sendsToken() throws Exception {
        properties.getNotifications().getWebhook().setToken("hook-secret");
        hookServer.enqueue(new MockResponse().setResponseCode(200));

        StepVerifier.create(sink().publish(EVENT)).verifyComplete();

        RecordedRequest request = hookServer.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request.getHeader(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer hook-secret");
    }

    @Test
    @DisplayName("reports a server error as a notification failure")
    void serverError() {
        hookServer.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        StepVerifier.create(sink().publish(EVENT))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(NotificationException.class);
                assertThat(error.getMessage()).contains("q-1");
            })
            .verify();
    }

    @Test
    @DisplayName("fails without calling out when no URL is configured")
    void missingUrl() {
        properties.getNotifications().getWebhook().setUrl(" ");

        StepVerifier.create(sink().publish(EVENT))
            .expectError(NotificationException.class)
            .verify();

        assertThat(hookServer.getRequestCount()).isZero();
    }
}
