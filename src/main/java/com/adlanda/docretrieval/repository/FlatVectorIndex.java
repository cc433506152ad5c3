package com.adlanda.docretrieval.repository;

import com.adlanda.docretrieval.exception.DimensionMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Exact vector index over a single contiguous float array.
 *
 * Vector {@code id} occupies {@code [id * dimensions, (id + 1) * dimensions)},
 * so ids are plain offsets. Search is a linear scan using squared Euclidean
 * distance. The arena is a single Java array, so the index holds at most
 * {@code (Integer.MAX_VALUE - 8) / dimensions} vectors.
 */
public class FlatVectorIndex implements VectorIndex {

    private static final int INITIAL_CAPACITY = 64;
    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private final int dimensions;
    private final int maxVectors;
    private float[] data;
    private int count;

    public FlatVectorIndex(int dimensions) {
        this(dimensions, maxVectors(dimensions));
    }

    FlatVectorIndex(int dimensions, int maxVectors) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive, was " + dimensions);
        }
        if (maxVectors <= 0 || maxVectors > maxVectors(dimensions)) {
            throw new IllegalArgumentException("maxVectors must be in 1.." + maxVectors(dimensions) + ", was " + maxVectors);
        }
        this.dimensions = dimensions;
        this.maxVectors = maxVectors;
        this.data = new float[arenaLength(initialCapacity())];
    }

    /**
     * Largest number of vectors of the given width that fit in one arena.
     */
    static int maxVectors(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive, was " + dimensions);
        }
        return MAX_ARRAY_LENGTH / dimensions;
    }

    @Override
    public List<Integer> add(List<float[]> vectors) {
        // validate everything before touching the arena so a bad batch leaves no trace
        for (float[] vector : vectors) {
            checkDimensions(vector);
        }

        ensureCapacity((long) count + vectors.size());

        List<Integer> ids = new ArrayList<>(vectors.size());
        for (float[] vector : vectors) {
            System.arraycopy(vector, 0, data, count * dimensions, dimensions);
            ids.add(count);
            count++;
        }
        return ids;
    }

    @Override
    public List<IndexHit> search(float[] query, int k) {
        checkDimensions(query);
        if (k <= 0 || count == 0) {
            return List.of();
        }

        IndexHit[] hits = new IndexHit[count];
        for (int id = 0; id < count; id++) {
            hits[id] = new IndexHit(id, squaredDistance(query, id * dimensions));
        }
        Arrays.sort(hits, IndexHit.RANKING);

        int limit = Math.min(k, count);
        return List.of(Arrays.copyOf(hits, limit));
    }

    @Override
    public void reset() {
        data = new float[arenaLength(initialCapacity())];
        count = 0;
    }

    @Override
    public int count() {
        return count;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private double squaredDistance(float[] query, int offset) {
        double sum = 0.0;
        for (int i = 0; i < dimensions; i++) {
            double diff = query[i] - data[offset + i];
            sum += diff * diff;
        }
        return sum;
    }

    private void checkDimensions(float[] vector) {
        if (vector == null || vector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, vector == null ? 0 : vector.length);
        }
    }

    private int initialCapacity() {
        return Math.min(INITIAL_CAPACITY, maxVectors);
    }

    private int arenaLength(int capacity) {
        try {
            return Math.multiplyExact(capacity, dimensions);
        } catch (ArithmeticException e) {
            throw new IllegalStateException("Vector index capacity exceeded: " + capacity
                    + " vectors of dimension " + dimensions + " do not fit in one array", e);
        }
    }

    // offsets below count * dimensions stay within int range once this has succeeded
    private void ensureCapacity(long required) {
        int capacity = data.length / dimensions;
        if (required <= capacity) {
            return;
        }
        if (required > maxVectors) {
            throw new IllegalStateException("Vector index is full: holds " + count + " of at most "
                    + maxVectors + " vectors of dimension " + dimensions + ", cannot add " + (required - count));
        }
        int newCapacity = (int) Math.min(maxVectors, Math.max(required, capacity * 2L));
        data = Arrays.copyOf(data, arenaLength(newCapacity));
    }
}
