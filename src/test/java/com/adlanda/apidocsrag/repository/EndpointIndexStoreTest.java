package com.adlanda.apidocsrag.repository;

import com.adlanda.apidocsrag.TestFixtures;
import com.adlanda.apidocsrag.index.EndpointIndex;
import com.adlanda.apidocsrag.model.EndpointMethod;
import com.adlanda.apidocsrag.model.EndpointRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointIndexStoreTest {

    private EndpointIndexStore store;

    @BeforeEach
    void setUp() {
        store = new EndpointIndexStore();
    }

    @Test
    void current_beforePublish_isEmptyAndNotLoaded() {
        assertThat(store.current()).isSameAs(EndpointIndex.empty());
        assertThat(store.size()).isZero();
        assertThat(store.isLoaded()).isFalse();
    }

    @Test
    void publish_replacesIndexAndReturnsPrevious() {
        EndpointIndex first = TestFixtures.index(TestFixtures.ticketCorpus());
        EndpointIndex second = TestFixtures.index(
                EndpointRecord.of(EndpointMethod.GET, "/agents", "List all agents"));

        EndpointIndex replaced = store.publish(first);
        assertThat(replaced).isSameAs(EndpointIndex.empty());

        replaced = store.publish(second);
        assertThat(replaced).isSameAs(first);
        assertThat(store.current()).isSameAs(second);
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.isLoaded()).isTrue();
    }

    @Test
    void publish_null_throwsException() {
        assertThatThrownBy(() -> store.publish(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("null index");
    }

    @Test
    void current_readersNeverSeeHalfPublishedIndex() throws Exception {
        EndpointIndex small = TestFixtures.index(TestFixtures.ticketCorpus());
        EndpointIndex large = TestFixtures.index(
                EndpointRecord.of(EndpointMethod.GET, "/agents", "List all agents"),
                EndpointRecord.of(EndpointMethod.GET, "/agents/{id}", "View an agent"),
                EndpointRecord.of(EndpointMethod.POST, "/agents", "Create an agent"));
        store.publish(small);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        AtomicBoolean running = new AtomicBoolean(true);
        try {
            Future<Integer> reader = executor.submit(() -> {
                int reads = 0;
                do {
                    EndpointIndex snapshot = store.current();
                    assertThat(snapshot.corpus().size()).isEqualTo(snapshot.size());
                    assertThat(snapshot).isIn(small, large);
                    reads++;
                } while (running.get());
                return reads;
            });
            for (int i = 0; i < 1000; i++) {
                store.publish(i % 2 == 0 ? large : small);
            }
            running.set(false);

            assertThat(reader.get(10, TimeUnit.SECONDS)).isPositive();
        } finally {
            executor.shutdownNow();
        }
    }
}
