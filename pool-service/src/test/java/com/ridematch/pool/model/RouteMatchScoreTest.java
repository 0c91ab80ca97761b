package com.ridematch.pool.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RouteMatchScoreTest {

    @Test
    void rejectedNeverClears() {
        assertThat(RouteMatchScore.rejected().clears(0.0)).isFalse();
    }

    @Test
    void clearsAtThreshold() {
        RouteMatchScore score = new RouteMatchScore(0.5, 2, 1, 10, 12.5);
        assertThat(score.clears(0.5)).isTrue();
        assertThat(score.clears(0.51)).isFalse();
    }
}
