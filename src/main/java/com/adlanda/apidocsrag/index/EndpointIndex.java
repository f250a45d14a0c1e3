package com.adlanda.apidocsrag.index;

import com.adlanda.apidocsrag.model.Corpus;

import java.util.List;
import java.util.Map;

/**
 * Immutable lexical index over one corpus.
 *
 * Holds per-record, per-field term frequencies and corpus-wide document frequencies.
 * An index is never mutated; a reload builds a new one and swaps it in whole.
 */
public final class EndpointIndex {

    private static final EndpointIndex EMPTY =
            new EndpointIndex(Corpus.empty(), List.of(), Map.of(), FieldWeights.DEFAULT, false);

    private final Corpus corpus;
    private final List<RecordTerms> records;
    private final Map<String, Integer> documentFrequencies;
    private final FieldWeights weights;
    private final boolean loaded;

    EndpointIndex(Corpus corpus,
                  List<RecordTerms> records,
                  Map<String, Integer> documentFrequencies,
                  FieldWeights weights,
                  boolean loaded) {
        if (corpus.size() != records.size()) {
            throw new IllegalArgumentException("Term statistics must cover every corpus record");
        }
        this.corpus = corpus;
        this.records = List.copyOf(records);
        this.documentFrequencies = Map.copyOf(documentFrequencies);
        this.weights = weights;
        this.loaded = loaded;
    }

    /**
     * Creates an index from precomputed statistics.
     */
    public static EndpointIndex of(Corpus corpus,
                                   List<RecordTerms> records,
                                   Map<String, Integer> documentFrequencies,
                                   FieldWeights weights) {
        return new EndpointIndex(corpus, records, documentFrequencies, weights, true);
    }

    /**
     * The placeholder published before any corpus has been loaded.
     */
    public static EndpointIndex empty() {
        return EMPTY;
    }

    public Corpus corpus() {
        return corpus;
    }

    public RecordTerms terms(int recordIndex) {
        return records.get(recordIndex);
    }

    public FieldWeights weights() {
        return weights;
    }

    public int size() {
        return corpus.size();
    }

    public boolean isLoaded() {
        return loaded;
    }

    /**
     * Number of records containing the term in at least one field.
     */
    public int documentFrequency(String term) {
        return documentFrequencies.getOrDefault(term, 0);
    }

    /**
     * {@code log(1 + N / df)}; zero for terms absent from the corpus.
     */
    public double inverseDocumentFrequency(String term) {
        int df = documentFrequency(term);
        if (df == 0) {
            return 0.0;
        }
        return Math.log(1.0 + (double) size() / df);
    }

    public int vocabularySize() {
        return documentFrequencies.size();
    }
}
