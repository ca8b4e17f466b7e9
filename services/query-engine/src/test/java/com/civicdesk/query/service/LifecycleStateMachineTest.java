package com.civicdesk.query.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.civicdesk.query.domain.QueryStatus;
import com.civicdesk.query.store.QueryDocument;
import com.civicdesk.query.store.QueryField;
import com.civicdesk.query.support.EngineHarness;
import com.civicdesk.query.support.MutableClock;
import com.civicdesk.query.support.TestFixtures;

import reactor.test.StepVerifier;

@DisplayName("Lifecycle state machine")
class LifecycleStateMachineTest {

    private static final Instant SUBMITTED = Instant.parse("2024-03-01T07:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-05T09:30:00Z");

    private MutableClock clock;
    private EngineHarness harness;
    private LifecycleStateMachine lifecycle;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        harness = new EngineHarness(clock);
        lifecycle = harness.lifecycle;
        harness.store.put(TestFixtures.openDocument("q-1", "QRY-001", SUBMITTED));
        harness.store.put(TestFixtures.resolvedDocument("q-2", SUBMITTED, Instant.parse("2024-03-03T22:00:00Z")));
    }

    @Nested
    @DisplayName("changeStatus")
    class ChangeStatus {

        @Test
        @DisplayName("moves an open query to Active and stamps the actor")
        void openToActive() {
            StepVerifier.create(lifecycle.changeStatus("q-1", QueryStatus.ACTIVE, TestFixtures.ADMIN))
                .assertNext(query -> {
                    assertThat(query.status()).isEqualTo(QueryStatus.ACTIVE);
                    assertThat(query.lastUpdated()).isEqualTo(NOW);
                    assertThat(query.updatedBy()).isEqualTo("ad-1");
                })
                .verifyComplete();

            assertThat(harness.store.document("q-1").get(QueryField.STATUS)).isEqualTo("Active");
        }

        @Test
        @DisplayName("reopening a resolved query drops its resolution in the same write")
        void reopenResolved() {
            StepVerifier.create(lifecycle.changeStatus("q-2", QueryStatus.OPEN, TestFixtures.ADMIN))
                .assertNext(query -> {
                    assertThat(query.status()).isEqualTo(QueryStatus.OPEN);
                    assertThat(query.resolution()).isNull();
                })
                .verifyComplete();

            QueryDocument stored = harness.store.document("q-2");
            assertThat(stored.fields()).doesNotContainKeys(
                QueryField.RESOLUTION_MESSAGE.key(), QueryField.RESOLUTION_DATE.key(), QueryField.RESOLVED_BY.key());
            assertThat(harness.store.writeCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("refuses Resolved because it needs a message")
        void resolvedIsNotDirect() {
            StepVerifier.create(lifecycle.changeStatus("q-1", QueryStatus.RESOLVED, TestFixtures.ADMIN))
                .expectError(ValidationException.class)
                .verify();

            assertThat(harness.store.writeCount()).isZero();
        }

        @Test
        @DisplayName("refuses customer accounts without writing")
        void customerDenied() {
            StepVerifier.create(lifecycle.changeStatus("q-1", QueryStatus.ACTIVE, TestFixtures.CUSTOMER))
                .expectError(AuthorizationException.class)
                .verify();

            assertThat(harness.store.writeCount()).isZero();
        }

        @Test
        @DisplayName("reports unknown queries as not found")
        void unknownQuery() {
            StepVerifier.create(lifecycle.changeStatus("missing", QueryStatus.ACTIVE, TestFixtures.ADMIN))
                .expectError(QueryNotFoundException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("Resolution protocol")
    class ResolutionProtocol {

        @Test
        @DisplayName("a proposal is remembered but nothing is written")
        void proposeDoesNotWrite() {
            StepVerifier.create(lifecycle.proposeResolution("q-1", TestFixtures.ADMIN))
                .assertNext(pending -> {
                    assertThat(pending.queryId()).isEqualTo("q-1");
                    assertThat(pending.referenceId()).isEqualTo("QRY-001");
                    assertThat(pending.priorStatus()).isEqualTo(QueryStatus.OPEN);
                    assertThat(pending.proposedAt()).isEqualTo(NOW);
                })
                .verifyComplete();

            assertThat(harness.store.writeCount()).isZero();
            assertThat(lifecycle.pendingResolution("q-1", "ad-1")).isPresent();
        }

        @Test
        @DisplayName("proposing on an unknown query fails")
        void proposeUnknown() {
            StepVerifier.create(lifecycle.proposeResolution("missing", TestFixtures.ADMIN))
                .expectError(QueryNotFoundException.class)
                .verify();
        }

        @Test
        @DisplayName("commit writes the whole resolution group with the status")
        void commitWritesResolution() {
            lifecycle.proposeResolution("q-1", TestFixtures.ADMIN).block();

            StepVerifier.create(lifecycle.commitResolution("q-1", "  Fixed meter  ", TestFixtures.ADMIN))
                .assertNext(query -> {
                    assertThat(query.status()).isEqualTo(QueryStatus.RESOLVED);
                    assertThat(query.resolution().message()).isEqualTo("Fixed meter");
                    assertThat(query.resolution().resolvedBy()).isEqualTo("Anele Mokoena");
                    // midnight 2024-03-05 in Johannesburg
                    assertThat(query.resolution().resolutionDate()).isEqualTo(Instant.parse("2024-03-04T22:00:00Z"));
                })
                .verifyComplete();

            assertThat(harness.store.writeCount()).isEqualTo(1);
            assertThat(harness.store.updates().get(0).names(QueryField.STATUS)).isTrue();
            assertThat(harness.store.updates().get(0).names(QueryField.RESOLUTION_MESSAGE)).isTrue();
            assertThat(lifecycle.pendingResolution("q-1", "ad-1")).isEmpty();
        }

        @Test
        @DisplayName("a blank message is rejected before any write")
        void blankMessage() {
            StepVerifier.create(lifecycle.commitResolution("q-1", "   ", TestFixtures.ADMIN))
                .expectError(ValidationException.class)
                .verify();

            assertThat(harness.store.writeCount()).isZero();
            assertThat(harness.store.document("q-1").get(QueryField.STATUS)).isEqualTo("Open");
        }

        @Test
        @DisplayName("cancel forgets the proposal without writing")
        void cancel() {
            lifecycle.proposeResolution("q-1", TestFixtures.ADMIN).block();

            StepVerifier.create(lifecycle.cancelResolution("q-1", TestFixtures.ADMIN))
                .verifyComplete();

            assertThat(lifecycle.pendingResolution("q-1", "ad-1")).isEmpty();
            assertThat(harness.store.writeCount()).isZero();
        }

        @Test
        @DisplayName("customer accounts cannot resolve")
        void customerCannotResolve() {
            StepVerifier.create(lifecycle.commitResolution("q-1", "done", TestFixtures.CUSTOMER))
                .expectError(AuthorizationException.class)
                .verify();

            assertThat(harness.store.writeCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Pending proposals")
    class PendingProposals {

        @Test
        @DisplayName("a proposal is kept until the configured time to live has passed")
        void expiresAfterTtl() {
            lifecycle.proposeResolution("q-1", TestFixtures.ADMIN).block();

            clock.set(NOW.plus(Duration.ofMinutes(29)));
            assertThat(lifecycle.pendingResolution("q-1", "ad-1")).isPresent();

            clock.set(NOW.plus(Duration.ofMinutes(31)));
            assertThat(lifecycle.pendingResolution("q-1", "ad-1")).isEmpty();
            assertThat(lifecycle.pendingCount()).isZero();
        }

        @Test
        @DisplayName("new proposals sweep out expired ones for other queries")
        void sweepOnPropose() {
            lifecycle.proposeResolution("q-1", TestFixtures.ADMIN).block();
            clock.set(NOW.plus(Duration.ofHours(2)));

            lifecycle.proposeResolution("q-2", TestFixtures.SUPERADMIN).block();

            assertThat(lifecycle.pendingCount()).isEqualTo(1);
            assertThat(lifecycle.pendingResolution("q-2", "sa-1")).isPresent();
        }

        @Test
        @DisplayName("a status change drops every proposal on that query")
        void droppedOnStatusChange() {
            lifecycle.proposeResolution("q-1", TestFixtures.ADMIN).block();
            lifecycle.proposeResolution("q-1", TestFixtures.SUPERADMIN).block();
            lifecycle.proposeResolution("q-2", TestFixtures.ADMIN).block();

            lifecycle.changeStatus("q-1", QueryStatus.ACTIVE, TestFixtures.ADMIN).block();

            assertThat(lifecycle.pendingResolution("q-1", "ad-1")).isEmpty();
            assertThat(lifecycle.pendingResolution("q-1", "sa-1")).isEmpty();
            assertThat(lifecycle.pendingResolution("q-2", "ad-1")).isPresent();
        }

        @Test
        @DisplayName("a failed status change keeps the proposals")
        void keptOnFailedChange() {
            lifecycle.proposeResolution("q-1", TestFixtures.ADMIN).block();
            harness.store.failWritesWith(new IllegalStateException("connection reset"));

            StepVerifier.create(lifecycle.changeStatus("q-1", QueryStatus.ACTIVE, TestFixtures.ADMIN))
                .expectError(PersistenceException.class)
                .verify();

            assertThat(lifecycle.pendingResolution("q-1", "ad-1")).isPresent();
        }
    }

    @Test
    @DisplayName("start of day follows the engine zone")
    void startOfDay() {
        assertThat(lifecycle.startOfDay(Instant.parse("2024-03-04T23:30:00Z")))
            .isEqualTo(Instant.parse("2024-03-04T22:00:00Z"));
    }
}
