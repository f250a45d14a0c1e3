package com.adlanda.apidocsrag.model;

import java.time.Instant;

/**
 * Result of a corpus reload.
 */
public record ReloadResponse(
        String status,
        int endpoints,
        int skippedEntries,
        Instant loadedAt,
        String checksum
) {
    public static ReloadResponse loaded(Corpus corpus) {
        return new ReloadResponse("loaded", corpus.size(), corpus.skippedEntries(), corpus.loadedAt(), corpus.checksum());
    }
}
