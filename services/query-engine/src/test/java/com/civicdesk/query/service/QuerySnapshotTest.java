package com.civicdesk.query.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.civicdesk.query.domain.ChangeType;
import com.civicdesk.query.domain.Query;
import com.civicdesk.query.domain.QueryChangeEvent;
import com.civicdesk.query.support.TestFixtures;

@DisplayName("Query snapshot")
class QuerySnapshotTest {

    private static final Instant SUBMITTED = Instant.parse("2024-03-01T07:00:00Z");

    @Test
    @DisplayName("reports every query of a fresh snapshot as added")
    void freshSnapshotIsAllAdded() {
        QuerySnapshot snapshot = QuerySnapshot.of(List.of(
            TestFixtures.openQuery("q-1", SUBMITTED),
            TestFixtures.openQuery("q-2", SUBMITTED)));

        assertThat(snapshot.changesSince(QuerySnapshot.EMPTY))
            .extracting(QueryChangeEvent::type)
            .containsExactly(ChangeType.ADDED, ChangeType.ADDED);
    }

    @Test
    @DisplayName("replaces a query with a newer version and reports it as modified")
    void upsertNewerVersion() {
        QuerySnapshot first = QuerySnapshot.EMPTY.upsert(TestFixtures.openQuery("q-1", SUBMITTED));
        Query newer = TestFixtures.openQuery("q-1", SUBMITTED, SUBMITTED.plusSeconds(60));

        QuerySnapshot second = first.upsert(newer);

        assertThat(second.find("q-1")).contains(newer);
        assertThat(second.version()).isGreaterThan(first.version());
        assertThat(second.changesSince(first)).containsExactly(QueryChangeEvent.modified(newer));
    }

    @Test
    @DisplayName("falls back to lastUpdated for copies without a revision")
    void ignoresStaleVersion() {
        Query current = TestFixtures.openQuery("q-1", SUBMITTED, SUBMITTED.plusSeconds(60));
        QuerySnapshot snapshot = QuerySnapshot.EMPTY.upsert(current);

        QuerySnapshot after = snapshot.upsert(TestFixtures.openQuery("q-1", SUBMITTED));

        assertThat(after).isSameAs(snapshot);
        assertThat(after.find("q-1")).contains(current);
    }

    @Test
    @DisplayName("orders copies by store revision, not by their lastUpdated clock")
    void ordersByRevision() {
        Query committedFirst = TestFixtures.openQuery("q-1", SUBMITTED, SUBMITTED.plusSeconds(3600));
        Query committedLast = TestFixtures.openQuery("q-1", SUBMITTED, SUBMITTED.plusSeconds(60));

        QuerySnapshot held = QuerySnapshot.EMPTY.upsert(committedFirst, 2);
        QuerySnapshot accepted = held.upsert(committedLast, 3);

        assertThat(accepted.find("q-1")).contains(committedLast);
        assertThat(accepted.revisionOf("q-1")).isEqualTo(3L);

        QuerySnapshot afterLateArrival = accepted.upsert(committedFirst, 2);

        assertThat(afterLateArrival).isSameAs(accepted);
        assertThat(afterLateArrival.find("q-1")).contains(committedLast);
    }

    @Test
    @DisplayName("ignores a copy at the revision it already holds")
    void ignoresSameRevision() {
        QuerySnapshot held = QuerySnapshot.EMPTY.upsert(TestFixtures.openQuery("q-1", SUBMITTED), 4);

        assertThat(held.upsert(TestFixtures.openQuery("q-1", SUBMITTED, SUBMITTED.plusSeconds(5)), 4)).isSameAs(held);
    }

    @Test
    @DisplayName("keeps a rejection until a later revision repairs the document")
    void rejectionIsOrderedByRevision() {
        QuerySnapshot rejected = QuerySnapshot.EMPTY
            .upsert(TestFixtures.openQuery("q-1", SUBMITTED), 1)
            .reject("q-1", 3);

        assertThat(rejected.upsert(TestFixtures.openQuery("q-1", SUBMITTED, SUBMITTED.plusSeconds(5)), 2)).isSameAs(rejected);

        QuerySnapshot repaired = rejected.upsert(TestFixtures.openQuery("q-1", SUBMITTED, SUBMITTED.plusSeconds(5)), 4);

        assertThat(repaired.rejectedIds()).isEmpty();
        assertThat(repaired.find("q-1")).isPresent();
    }

    @Test
    @DisplayName("reports removed queries")
    void removal() {
        Query query = TestFixtures.openQuery("q-1", SUBMITTED);
        QuerySnapshot before = QuerySnapshot.EMPTY.upsert(query);

        QuerySnapshot after = before.remove("q-1");

        assertThat(after.size()).isZero();
        assertThat(after.changesSince(before)).containsExactly(QueryChangeEvent.removed(query));
        assertThat(after.remove("q-1")).isSameAs(after);
    }

    @Test
    @DisplayName("drops a rejected document and clears the flag once a valid version arrives")
    void rejection() {
        QuerySnapshot held = QuerySnapshot.EMPTY.upsert(TestFixtures.openQuery("q-1", SUBMITTED));

        QuerySnapshot rejected = held.reject("q-1");

        assertThat(rejected.find("q-1")).isEmpty();
        assertThat(rejected.rejectedIds()).containsExactly("q-1");

        QuerySnapshot repaired = rejected.upsert(TestFixtures.openQuery("q-1", SUBMITTED, SUBMITTED.plusSeconds(5)));

        assertThat(repaired.rejectedIds()).isEmpty();
        assertThat(repaired.find("q-1")).isPresent();
    }

    @Test
    @DisplayName("never changes after it has been handed out")
    void isImmutable() {
        QuerySnapshot before = QuerySnapshot.EMPTY.upsert(TestFixtures.openQuery("q-1", SUBMITTED));

        before.upsert(TestFixtures.openQuery("q-2", SUBMITTED)).remove("q-1");

        assertThat(before.queries()).extracting(Query::id).containsExactly("q-1");
    }
}
