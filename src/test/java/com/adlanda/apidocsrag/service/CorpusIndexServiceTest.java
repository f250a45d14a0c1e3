package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.TestFixtures;
import com.adlanda.apidocsrag.config.RetrievalProperties;
import com.adlanda.apidocsrag.exception.CorpusLoadException;
import com.adlanda.apidocsrag.health.CorpusHealthIndicator;
import com.adlanda.apidocsrag.index.EndpointIndex;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.model.EndpointMethod;
import com.adlanda.apidocsrag.model.EndpointRecord;
import com.adlanda.apidocsrag.repository.EndpointIndexStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CorpusIndexServiceTest {

    @Mock
    private CorpusLoader loader;

    private EndpointIndexStore indexStore;
    private CorpusHealthIndicator healthIndicator;
    private CorpusIndexService service;

    @BeforeEach
    void setUp() {
        indexStore = new EndpointIndexStore();
        healthIndicator = new CorpusHealthIndicator();
        EndpointIndexer indexer = new EndpointIndexer(new QueryAnalyzer(), new RetrievalProperties());
        service = new CorpusIndexService(loader, indexer, indexStore, healthIndicator);
    }

    @Test
    void reload_publishesFreshIndex() {
        Corpus corpus = TestFixtures.ticketCorpus();
        when(loader.load()).thenReturn(corpus);

        Corpus loaded = service.reload();

        assertThat(loaded).isSameAs(corpus);
        assertThat(indexStore.isLoaded()).isTrue();
        assertThat(indexStore.current().corpus()).isSameAs(corpus);
        assertThat(indexStore.current().documentFrequency("ticket")).isEqualTo(2);
        assertThat(service.currentCorpus()).isSameAs(corpus);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void reload_failureKeepsPreviousIndex() {
        Corpus first = TestFixtures.ticketCorpus();
        when(loader.load())
                .thenReturn(first)
                .thenThrow(new CorpusLoadException(CorpusLoadException.Reason.MALFORMED, "Corpus source is not valid JSON"));
        service.reload();
        EndpointIndex published = indexStore.current();

        assertThatThrownBy(() -> service.reload())
                .isInstanceOf(CorpusLoadException.class)
                .hasMessage("Corpus source is not valid JSON");

        assertThat(indexStore.current()).isSameAs(published);
        Health health = healthIndicator.health();
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("endpoints", 2)
                .containsEntry("lastReloadError", "MALFORMED: Corpus source is not valid JSON");
    }

    @Test
    void reload_initialFailureLeavesStoreEmpty() {
        when(loader.load())
                .thenThrow(new CorpusLoadException(CorpusLoadException.Reason.EMPTY, "Corpus contains no valid endpoint entries"));

        assertThatThrownBy(() -> service.reload())
                .isInstanceOf(CorpusLoadException.class)
                .extracting(e -> ((CorpusLoadException) e).getReason())
                .isEqualTo(CorpusLoadException.Reason.EMPTY);

        assertThat(indexStore.isLoaded()).isFalse();
        assertThat(indexStore.size()).isZero();
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void reload_replacesIndexWithNewCorpus() {
        Corpus second = Corpus.of(List.of(
                EndpointRecord.of(EndpointMethod.GET, "/agents", "List all agents")));
        when(loader.load()).thenReturn(TestFixtures.ticketCorpus(), second);

        service.reload();
        service.reload();

        assertThat(indexStore.size()).isEqualTo(1);
        assertThat(indexStore.current().documentFrequency("ticket")).isZero();
        assertThat(indexStore.current().documentFrequency("agents")).isEqualTo(1);
    }
}
