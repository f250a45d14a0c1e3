package com.adlanda.apidocsrag.repository;

import com.adlanda.apidocsrag.index.EndpointIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the index that queries are served from.
 *
 * The index itself is immutable. Publishing replaces the whole reference, so a reader
 * that takes one {@link #current()} snapshot sees either the old or the new index in full.
 */
@Repository
public class EndpointIndexStore {

    private static final Logger log = LoggerFactory.getLogger(EndpointIndexStore.class);

    private final AtomicReference<EndpointIndex> current = new AtomicReference<>(EndpointIndex.empty());

    /**
     * Returns the currently published index. Callers should read it once per request.
     */
    public EndpointIndex current() {
        return current.get();
    }

    /**
     * Publishes a new index, replacing the previous one.
     *
     * @return the index that was replaced
     */
    public EndpointIndex publish(EndpointIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("Cannot publish a null index");
        }
        EndpointIndex previous = current.getAndSet(index);
        log.info("Published index with {} endpoints (previously {})", index.size(), previous.size());
        return previous;
    }

    /**
     * Returns the number of endpoints in the published index.
     */
    public int size() {
        return current.get().size();
    }

    public boolean isLoaded() {
        return current.get().isLoaded();
    }
}
