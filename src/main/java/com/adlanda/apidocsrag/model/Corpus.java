package com.adlanda.apidocsrag.model;

import java.time.Instant;
import java.util.List;

/**
 * The full ordered collection of endpoint records plus load metadata.
 *
 * @param endpoints      Records in source order; the position is the record's identity
 * @param baseUrl        Base URL of the documented API, null when the source does not say
 * @param sourceTimestamp When the source was produced (scrape time), null when unknown
 * @param loadedAt       When this corpus was loaded
 * @param skippedEntries Number of malformed entries dropped during load
 * @param checksum       SHA-256 of the source bytes, hex encoded
 */
public record Corpus(
        List<EndpointRecord> endpoints,
        String baseUrl,
        Instant sourceTimestamp,
        Instant loadedAt,
        int skippedEntries,
        String checksum
) {
    public Corpus {
        endpoints = List.copyOf(endpoints);
    }

    /**
     * Creates a corpus without source metadata, mostly useful in tests.
     */
    public static Corpus of(List<EndpointRecord> endpoints) {
        return new Corpus(endpoints, null, null, Instant.now(), 0, null);
    }

    public static Corpus empty() {
        return new Corpus(List.of(), null, null, null, 0, null);
    }

    public int size() {
        return endpoints.size();
    }

    public EndpointRecord get(int index) {
        return endpoints.get(index);
    }

    public boolean isEmpty() {
        return endpoints.isEmpty();
    }
}
