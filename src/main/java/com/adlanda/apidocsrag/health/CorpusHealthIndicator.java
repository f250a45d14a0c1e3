package com.adlanda.apidocsrag.health;

import com.adlanda.apidocsrag.model.Corpus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the endpoint corpus.
 *
 * Reports the status of the last load or reload, including:
 * - Number of endpoints indexed and entries skipped
 * - Load timestamp and source checksum
 * - The error of the last failed reload, if any
 *
 * A failed reload leaves the previous index serving, so the service stays UP
 * as long as some corpus has been loaded.
 */
@Component
public class CorpusHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(null, "Corpus not yet loaded", null)
    );

    /**
     * Records a successful load.
     */
    public void markLoaded(Corpus corpus) {
        state.set(new HealthState(CorpusSummary.of(corpus), null, Instant.now()));
    }

    /**
     * Records a failed load, keeping the summary of the corpus still being served.
     */
    public void markFailed(String error) {
        state.updateAndGet(current -> new HealthState(current.summary(), error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.summary() != null) {
            CorpusSummary summary = current.summary();
            Health.Builder builder = Health.up()
                    .withDetail("endpoints", summary.endpoints())
                    .withDetail("skippedEntries", summary.skippedEntries())
                    .withDetail("loadedAt", summary.loadedAt() != null ? summary.loadedAt().toString() : "unknown")
                    .withDetail("checksum", summary.checksum() != null ? summary.checksum() : "unknown");
            if (current.error() != null) {
                builder.withDetail("lastReloadError", current.error())
                       .withDetail("lastReloadAttempt", current.timestamp().toString());
            }
            return builder.build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp() != null ? current.timestamp().toString() : "never")
                .build();
    }

    /**
     * Internal state holder for thread-safe health updates.
     */
    private record HealthState(CorpusSummary summary, String error, Instant timestamp) {}

    private record CorpusSummary(int endpoints, int skippedEntries, Instant loadedAt, String checksum) {
        static CorpusSummary of(Corpus corpus) {
            return new CorpusSummary(corpus.size(), corpus.skippedEntries(), corpus.loadedAt(), corpus.checksum());
        }
    }
}
