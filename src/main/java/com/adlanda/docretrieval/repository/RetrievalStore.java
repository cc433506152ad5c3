package com.adlanda.docretrieval.repository;

import com.adlanda.docretrieval.exception.ConfigurationException;
import com.adlanda.docretrieval.exception.DimensionMismatchException;
import com.adlanda.docretrieval.exception.EmbeddingMismatchException;
import com.adlanda.docretrieval.model.AddResult;
import com.adlanda.docretrieval.model.ChunkMetadata;
import com.adlanda.docretrieval.model.ResetResult;
import com.adlanda.docretrieval.model.SearchHit;
import com.adlanda.docretrieval.service.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory retrieval store: a vector index plus the metadata of every vector.
 *
 * Embeddings are computed before any lock is taken. Only committing a batch to
 * the index and metadata, and reset, hold the write lock; searches and
 * counters hold the read lock. A batch is validated completely before it is
 * committed, so a rejected batch leaves both structures untouched and for every
 * id in the index there is exactly one metadata entry.
 */
public class RetrievalStore {

    private static final Logger log = LoggerFactory.getLogger(RetrievalStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex index;
    private final MetadataStore metadata = new MetadataStore();
    private final int dimensions;

    private volatile Instant lastReset;

    public RetrievalStore(EmbeddingProvider embeddingProvider) {
        this(embeddingProvider, resolveDimensions(Objects.requireNonNull(embeddingProvider, "embeddingProvider")));
    }

    public RetrievalStore(EmbeddingProvider embeddingProvider, VectorIndex index) {
        this(embeddingProvider, index,
                resolveDimensions(Objects.requireNonNull(embeddingProvider, "embeddingProvider")));
    }

    private RetrievalStore(EmbeddingProvider embeddingProvider, int dimensions) {
        this(embeddingProvider, new FlatVectorIndex(dimensions), dimensions);
    }

    private RetrievalStore(EmbeddingProvider embeddingProvider, VectorIndex index, int dimensions) {
        this.embeddingProvider = embeddingProvider;
        this.index = Objects.requireNonNull(index, "index");
        this.dimensions = dimensions;
        if (index.dimensions() != dimensions) {
            throw new ConfigurationException("Index dimension " + index.dimensions()
                    + " does not match embedding dimension " + dimensions);
        }
        log.info("Retrieval store ready (dimensions: {})", dimensions);
    }

    /**
     * Embeds and stores a batch of chunks from one document.
     *
     * @param chunks       Chunk texts in document order
     * @param documentName Name the chunks are recorded under
     * @return Number of chunks added and the new total
     * @throws EmbeddingMismatchException if the provider returns the wrong number of vectors
     * @throws DimensionMismatchException if a returned vector has the wrong width
     */
    public AddResult addDocuments(List<String> chunks, String documentName) {
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(documentName, "documentName");

        if (chunks.isEmpty()) {
            log.info("No chunks provided for document: {}", documentName);
            return new AddResult(0, totalVectors());
        }

        log.info("Generating embeddings for {} chunks from '{}'", chunks.size(), documentName);
        List<float[]> embeddings = embeddingProvider.encode(chunks);
        checkBatch(embeddings, chunks.size());

        lock.writeLock().lock();
        try {
            List<Integer> ids = index.add(embeddings);
            int firstChunkNumber = metadata.reserve(documentName, chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                metadata.record(ids.get(i), documentName, firstChunkNumber + i, chunks.get(i));
            }
            int total = index.count();
            log.info("Added {} chunks from '{}' (ids {}..{}), total vectors: {}",
                    chunks.size(), documentName, ids.get(0), ids.get(ids.size() - 1), total);
            return new AddResult(chunks.size(), total);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Finds the chunks closest to the query text.
     *
     * @param queryText The query
     * @param k         Maximum number of results, at least 1
     * @return Hits ordered by ascending distance; empty if the store is empty
     */
    public List<SearchHit> search(String queryText, int k) {
        Objects.requireNonNull(queryText, "queryText");
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, was " + k);
        }

        if (totalVectors() == 0) {
            log.debug("Store is empty, skipping query embedding");
            return List.of();
        }

        List<float[]> embedded = embeddingProvider.encode(List.of(queryText));
        checkBatch(embedded, 1);
        float[] queryVector = embedded.get(0);

        lock.readLock().lock();
        try {
            int count = index.count();
            if (count == 0) {
                return List.of();
            }

            List<VectorIndex.IndexHit> hits = index.search(queryVector, Math.min(k, count));
            List<SearchHit> results = new ArrayList<>(hits.size());
            for (VectorIndex.IndexHit hit : hits) {
                Optional<ChunkMetadata> entry = metadata.get(hit.id());
                if (entry.isEmpty()) {
                    log.warn("Vector {} has no metadata entry; excluding it from results", hit.id());
                    continue;
                }
                results.add(SearchHit.from(entry.get(), hit.distance()));
            }
            log.debug("Query '{}' matched {} of {} vectors", truncate(queryText, 50), results.size(), count);
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Clears the index, the metadata and the per-document counters in one step.
     */
    public ResetResult reset() {
        lock.writeLock().lock();
        try {
            int dropped = index.count();
            index.reset();
            metadata.reset();
            lastReset = Instant.now();
            log.info("Retrieval store reset, dropped {} vectors", dropped);
            return new ResetResult(index.count());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int totalVectors() {
        lock.readLock().lock();
        try {
            return index.count();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Document names indexed since the last reset, in first-seen order.
     */
    public List<String> documentNames() {
        lock.readLock().lock();
        try {
            return metadata.documentNames();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int dimensions() {
        return dimensions;
    }

    /**
     * Time of the last reset, or {@code null} if the store was never reset.
     */
    public Instant lastReset() {
        return lastReset;
    }

    private void checkBatch(List<float[]> embeddings, int expected) {
        int actual = embeddings == null ? 0 : embeddings.size();
        if (actual != expected) {
            throw new EmbeddingMismatchException(expected, actual);
        }
        for (float[] vector : embeddings) {
            int width = vector == null ? 0 : vector.length;
            if (width != dimensions) {
                throw new DimensionMismatchException(dimensions, width);
            }
        }
    }

    private static int resolveDimensions(EmbeddingProvider embeddingProvider) {
        int dimensions;
        try {
            dimensions = embeddingProvider.dimensions();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Embedding provider unavailable: " + e.getMessage(), e);
        }
        if (dimensions <= 0) {
            throw new ConfigurationException("Embedding dimension unknown (reported " + dimensions + ")");
        }
        return dimensions;
    }

    private static String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
