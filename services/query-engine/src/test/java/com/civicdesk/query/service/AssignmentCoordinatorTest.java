package com.civicdesk.query.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.civicdesk.query.domain.AssignmentNotificationEvent;
import com.civicdesk.query.domain.QueryStatus;
import com.civicdesk.query.domain.StaffUser;
import com.civicdesk.query.store.QueryDocument;
import com.civicdesk.query.store.QueryField;
import com.civicdesk.query.support.EngineHarness;
import com.civicdesk.query.support.MutableClock;
import com.civicdesk.query.support.TestFixtures;

import reactor.test.StepVerifier;

@DisplayName("Assignment coordinator")
class AssignmentCoordinatorTest {

    private static final Instant SUBMITTED = Instant.parse("2024-03-01T07:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-01T10:15:00Z");

    private EngineHarness harness;
    private AssignmentCoordinator coordinator;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness(new MutableClock(NOW));
        coordinator = harness.assignments;
        harness.store.put(TestFixtures.openDocument("q-1", "QRY-001", SUBMITTED));
        harness.store.put(TestFixtures.resolvedDocument("q-2", SUBMITTED, Instant.parse("2024-03-03T22:00:00Z")));
    }

    @Nested
    @DisplayName("assign")
    class Assign {

        @Test
        @DisplayName("writes the assignment, forces Active and notifies the assignee")
        void assignsOpenQuery() {
            StepVerifier.create(coordinator.assign("q-1", "ad-1", TestFixtures.SUPERADMIN))
                .assertNext(query -> {
                    assertThat(query.status()).isEqualTo(QueryStatus.ACTIVE);
                    assertThat(query.assignment().assignedTo()).isEqualTo("ad-1");
                    assertThat(query.assignment().assignedToName()).isEqualTo("Anele Mokoena");
                    assertThat(query.assignment().assignedBy()).isEqualTo("sa-1");
                    assertThat(query.assignment().assignedAt()).isEqualTo(NOW);
                    assertThat(query.updatedBy()).isEqualTo("sa-1");
                })
                .verifyComplete();

            assertThat(harness.notifications.events()).singleElement().satisfies(event -> {
                assertThat(event.type()).isEqualTo(AssignmentNotificationEvent.QUERY_ASSIGNMENT);
                assertThat(event.recipientId()).isEqualTo("ad-1");
                assertThat(event.senderId()).isEqualTo("sa-1");
                assertThat(event.senderName()).isEqualTo("Sipho Dlamini");
                assertThat(event.queryId()).isEqualTo("q-1");
                assertThat(event.queryTitle()).isEqualTo("QRY-001");
                assertThat(event.queryDescription()).isEqualTo("Water meter reading looks wrong");
                assertThat(event.read()).isFalse();
                assertThat(event.createdAt()).isEqualTo(NOW);
            });
        }

        @Test
        @DisplayName("reactivates a resolved query and clears its resolution")
        void assignsResolvedQuery() {
            StepVerifier.create(coordinator.assign("q-2", "ad-2", TestFixtures.SUPERADMIN))
                .assertNext(query -> {
                    assertThat(query.status()).isEqualTo(QueryStatus.ACTIVE);
                    assertThat(query.resolution()).isNull();
                })
                .verifyComplete();

            assertThat(harness.store.document("q-2").fields()).doesNotContainKey(QueryField.RESOLUTION_MESSAGE.key());
        }

        @Test
        @DisplayName("reassignment overwrites the previous assignee")
        void reassign() {
            coordinator.assign("q-1", "ad-1", TestFixtures.SUPERADMIN).block();

            StepVerifier.create(coordinator.assign("q-1", "ad-2", TestFixtures.SUPERADMIN))
                .assertNext(query -> assertThat(query.assignment().assignedTo()).isEqualTo("ad-2"))
                .verifyComplete();

            assertThat(harness.notifications.events()).extracting(AssignmentNotificationEvent::recipientId)
                .containsExactly("ad-1", "ad-2");
        }

        @Test
        @DisplayName("admins may not assign: nothing is written or sent")
        void adminDenied() {
            StepVerifier.create(coordinator.assign("q-1", "ad-2", TestFixtures.ADMIN))
                .expectError(AuthorizationException.class)
                .verify();

            assertThat(harness.store.writeCount()).isZero();
            assertThat(harness.notifications.events()).isEmpty();
            assertThat(harness.store.document("q-1").get(QueryField.STATUS)).isEqualTo("Open");
        }

        @Test
        @DisplayName("an unknown assignee is reported as not found")
        void unknownAssignee() {
            StepVerifier.create(coordinator.assign("q-1", "nobody", TestFixtures.SUPERADMIN))
                .expectError(StaffUserNotFoundException.class)
                .verify();

            assertThat(harness.store.writeCount()).isZero();
        }

        @Test
        @DisplayName("customer accounts cannot be assignees")
        void customerAssignee() {
            StepVerifier.create(coordinator.assign("q-1", "cu-1", TestFixtures.SUPERADMIN))
                .expectError(ValidationException.class)
                .verify();

            assertThat(harness.store.writeCount()).isZero();
        }

        @Test
        @DisplayName("an unknown query is reported as not found and nobody is notified")
        void unknownQuery() {
            StepVerifier.create(coordinator.assign("missing", "ad-1", TestFixtures.SUPERADMIN))
                .expectError(QueryNotFoundException.class)
                .verify();

            assertThat(harness.notifications.events()).isEmpty();
        }

        @Test
        @DisplayName("a failing notification does not undo the assignment")
        void notificationFailure() {
            harness.notifications.failAll();

            StepVerifier.create(coordinator.assign("q-1", "ad-1", TestFixtures.SUPERADMIN))
                .assertNext(query -> assertThat(query.status()).isEqualTo(QueryStatus.ACTIVE))
                .verifyComplete();

            assertThat(harness.store.document("q-1").get(QueryField.ASSIGNED_TO)).isEqualTo("ad-1");
        }

        @Test
        @DisplayName("a query without a reference gets the default notification title")
        void defaultTitle() {
            Map<String, Object> fields = new LinkedHashMap<>(TestFixtures.openDocument("q-3", "x", SUBMITTED).fields());
            fields.remove(QueryField.REFERENCE_ID.key());
            fields.remove(QueryField.DESCRIPTION.key());
            harness.store.put(new QueryDocument("q-3", fields));

            coordinator.assign("q-3", "ad-1", TestFixtures.SUPERADMIN).block();

            assertThat(harness.notifications.events()).singleElement().satisfies(event -> {
                assertThat(event.queryTitle()).isEqualTo("New Query Assignment");
                assertThat(event.queryDescription()).isEmpty();
            });
        }
    }

    @Nested
    @DisplayName("listAssignableStaff")
    class ListAssignableStaff {

        @Test
        @DisplayName("lists admins ordered by name")
        void listsAdmins() {
            StepVerifier.create(coordinator.listAssignableStaff(TestFixtures.SUPERADMIN))
                .assertNext(staff -> assertThat(staff).extracting(StaffUser::id).containsExactly("ad-1", "ad-2"))
                .verifyComplete();
        }

        @Test
        @DisplayName("is reserved to superadmins")
        void adminDenied() {
            StepVerifier.create(coordinator.listAssignableStaff(TestFixtures.ADMIN))
                .expectError(AuthorizationException.class)
                .verify();
        }
    }
}
