package com.adlanda.docretrieval.health;

import com.adlanda.docretrieval.repository.RetrievalStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Health indicator for the in-memory vector store.
 *
 * The store is fully built before the context starts, so it always reports UP
 * with the current index statistics.
 */
@Component
public class VectorStoreHealthIndicator implements HealthIndicator {

    private final RetrievalStore retrievalStore;

    public VectorStoreHealthIndicator(RetrievalStore retrievalStore) {
        this.retrievalStore = retrievalStore;
    }

    @Override
    public Health health() {
        Instant lastReset = retrievalStore.lastReset();
        return Health.up()
                .withDetail("totalVectors", retrievalStore.totalVectors())
                .withDetail("documents", retrievalStore.documentNames().size())
                .withDetail("embeddingDimensions", retrievalStore.dimensions())
                .withDetail("lastReset", lastReset != null ? lastReset.toString() : "never")
                .build();
    }
}
