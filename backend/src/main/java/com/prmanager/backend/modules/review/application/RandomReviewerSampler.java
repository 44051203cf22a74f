package com.prmanager.backend.modules.review.application;

import java.util.Arrays;
import java.util.Random;

/**
 * Partial Fisher-Yates over the identity permutation.
 * {@link Random} is thread-safe, so one instance serves every request.
 */
public class RandomReviewerSampler implements ReviewerSampler {

    private final Random random;

    public RandomReviewerSampler(Random random) {
        this.random = random;
    }

    public static RandomReviewerSampler seeded(long seed) {
        return new RandomReviewerSampler(new Random(seed));
    }

    public static RandomReviewerSampler unseeded() {
        return new RandomReviewerSampler(new Random());
    }

    @Override
    public int[] sampleIndices(int poolSize, int count) {
        if (poolSize < 0 || count < 0) {
            throw new IllegalArgumentException("poolSize and count must be non-negative");
        }
        int draws = Math.min(poolSize, count);
        int[] indices = new int[poolSize];
        for (int i = 0; i < poolSize; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < draws; i++) {
            int j = i + random.nextInt(poolSize - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return Arrays.copyOf(indices, draws);
    }
}
