package com.adlanda.apidocsrag.service;

import com.adlanda.apidocsrag.exception.CorpusLoadException;
import com.adlanda.apidocsrag.health.CorpusHealthIndicator;
import com.adlanda.apidocsrag.index.EndpointIndex;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.repository.EndpointIndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Loads the corpus, builds its index and publishes it.
 *
 * Reloads are serialized; queries are never blocked because they only read the
 * published reference. If a reload fails the previous index keeps serving.
 */
@Service
public class CorpusIndexService {

    private static final Logger log = LoggerFactory.getLogger(CorpusIndexService.class);

    private final CorpusLoader loader;
    private final EndpointIndexer indexer;
    private final EndpointIndexStore indexStore;
    private final CorpusHealthIndicator healthIndicator;

    public CorpusIndexService(CorpusLoader loader,
                              EndpointIndexer indexer,
                              EndpointIndexStore indexStore,
                              CorpusHealthIndicator healthIndicator) {
        this.loader = loader;
        this.indexer = indexer;
        this.indexStore = indexStore;
        this.healthIndicator = healthIndicator;
    }

    /**
     * Loads the configured corpus and swaps in a freshly built index.
     *
     * @return The corpus now being served
     * @throws CorpusLoadException if the corpus cannot be loaded; the published index is left unchanged
     */
    public synchronized Corpus reload() {
        boolean hadIndex = indexStore.isLoaded();
        try {
            Corpus corpus = loader.load();
            EndpointIndex index = indexer.build(corpus);
            indexStore.publish(index);
            healthIndicator.markLoaded(corpus);
            return corpus;
        } catch (CorpusLoadException e) {
            healthIndicator.markFailed(e.getReason() + ": " + e.getMessage());
            if (hadIndex) {
                log.warn("Reload failed ({}), keeping previous index of {} endpoints: {}",
                        e.getReason(), indexStore.size(), e.getMessage());
            } else {
                log.error("Corpus load failed ({}): {}", e.getReason(), e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Returns the corpus behind the published index.
     */
    public Corpus currentCorpus() {
        return indexStore.current().corpus();
    }
}
