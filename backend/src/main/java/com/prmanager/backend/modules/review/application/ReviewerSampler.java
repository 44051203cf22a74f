package com.prmanager.backend.modules.review.application;

/**
 * Source of randomness for reviewer selection. Implementations must be safe to share
 * between concurrent requests.
 */
public interface ReviewerSampler {

    /**
     * Draws {@code min(poolSize, count)} distinct indices from {@code [0, poolSize)} without
     * replacement. Every combination of that size is equally likely.
     */
    int[] sampleIndices(int poolSize, int count);

    /**
     * One index drawn uniformly from {@code [0, poolSize)}.
     */
    default int pickIndex(int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive to pick an index");
        }
        return sampleIndices(poolSize, 1)[0];
    }
}
