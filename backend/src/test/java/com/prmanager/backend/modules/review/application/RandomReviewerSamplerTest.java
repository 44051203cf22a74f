package com.prmanager.backend.modules.review.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RandomReviewerSamplerTest {

    @Test
    @DisplayName("min(n, k)개의 서로 다른 인덱스를 [0, n) 범위에서 뽑는다")
    void drawsDistinctIndicesInRange() {
        RandomReviewerSampler sampler = RandomReviewerSampler.seeded(7L);

        for (int n = 0; n <= 6; n++) {
            for (int k = 0; k <= 8; k++) {
                int[] picked = sampler.sampleIndices(n, k);
                Set<Integer> distinct = new HashSet<>();
                Arrays.stream(picked).forEach(distinct::add);

                assertThat(picked).hasSize(Math.min(n, k));
                assertThat(distinct).hasSize(picked.length);
                for (int index : picked) {
                    assertThat(index).isBetween(0, n - 1);
                }
            }
        }
    }

    @Test
    @DisplayName("빈 풀에서는 아무것도 뽑지 않는다")
    void emptyPool() {
        assertThat(RandomReviewerSampler.unseeded().sampleIndices(0, 2)).isEmpty();
    }

    @Test
    @DisplayName("같은 시드는 같은 순서를 만든다")
    void sameSeedSameSequence() {
        RandomReviewerSampler first = RandomReviewerSampler.seeded(42L);
        RandomReviewerSampler second = RandomReviewerSampler.seeded(42L);

        for (int i = 0; i < 20; i++) {
            assertThat(first.sampleIndices(10, 3)).containsExactly(second.sampleIndices(10, 3));
        }
    }

    @Test
    @DisplayName("충분히 반복하면 모든 인덱스가 한 번 이상 뽑힌다")
    void everyIndexEventuallyDrawn() {
        RandomReviewerSampler sampler = RandomReviewerSampler.seeded(1L);
        Set<Integer> seen = new HashSet<>();

        for (int i = 0; i < 200; i++) {
            seen.add(sampler.pickIndex(5));
        }

        assertThat(seen).containsExactlyInAnyOrder(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("음수 입력과 빈 풀에서의 단일 선택은 거부된다")
    void rejectsInvalidInput() {
        RandomReviewerSampler sampler = RandomReviewerSampler.seeded(3L);

        assertThatThrownBy(() -> sampler.sampleIndices(-1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sampler.sampleIndices(3, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sampler.pickIndex(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
