package com.phillippitts.enginecoordinator.service.recall;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecallQueryTest {

    @Test
    void vectorsWithCollidingHashCodesGetDistinctCacheKeys() {
        int a = Float.floatToIntBits(1.0f);
        int b = Float.floatToIntBits(2.0f);
        float[] first = {1.0f, 2.0f};
        float[] second = {Float.intBitsToFloat(a + 1), Float.intBitsToFloat(b - 31)};
        assertThat(Arrays.hashCode(first)).isEqualTo(Arrays.hashCode(second));

        RecallQuery q1 = new RecallQuery(null, first, 3, null);
        RecallQuery q2 = new RecallQuery(null, second, 3, null);

        assertThat(q1.cacheKey()).isNotEqualTo(q2.cacheKey());
    }

    @Test
    void cacheKeyIgnoresBudgetButNotTopK() {
        RecallQuery fast = RecallQuery.byKey(" project notes ", 3, Duration.ofMillis(50));
        RecallQuery slow = RecallQuery.byKey("project notes", 3, Duration.ofSeconds(2));
        RecallQuery wider = RecallQuery.byKey("project notes", 5, Duration.ofMillis(50));

        assertThat(fast.cacheKey()).isEqualTo(slow.cacheKey());
        assertThat(fast.cacheKey()).isNotEqualTo(wider.cacheKey());
    }

    @Test
    void requiresKeyOrVector() {
        assertThatThrownBy(() -> new RecallQuery(" ", new float[0], 3, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
