package com.adlanda.apidocsrag;

import com.adlanda.apidocsrag.config.RetrievalProperties;
import com.adlanda.apidocsrag.index.EndpointIndex;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.model.EndpointMethod;
import com.adlanda.apidocsrag.model.EndpointRecord;
import com.adlanda.apidocsrag.service.EndpointIndexer;
import com.adlanda.apidocsrag.service.QueryAnalyzer;

import java.util.List;

/**
 * Shared corpora and index builders for unit tests.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    /**
     * The two-record ticket corpus: POST /tickets and GET /tickets/{id}.
     */
    public static Corpus ticketCorpus() {
        return Corpus.of(List.of(
                EndpointRecord.of(EndpointMethod.POST, "/tickets", "Create a new ticket"),
                EndpointRecord.of(EndpointMethod.GET, "/tickets/{id}", "Get ticket details")
        ));
    }

    public static EndpointIndex index(Corpus corpus) {
        return index(corpus, new RetrievalProperties());
    }

    public static EndpointIndex index(Corpus corpus, RetrievalProperties properties) {
        return new EndpointIndexer(new QueryAnalyzer(), properties).build(corpus);
    }

    public static EndpointIndex index(EndpointRecord... records) {
        return index(Corpus.of(List.of(records)));
    }
}
