package com.ridematch.dispatch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class OfferBatchesTest {

    @Test
    @DisplayName("Splits after the first batch, preserving order")
    void splitsInOrder() {
        OfferBatches batches = OfferBatches.split(drivers(5), 3);

        assertThat(batches.immediate()).extracting(DriverCandidate::getDriverId).containsExactly("d0", "d1", "d2");
        assertThat(batches.delayed()).extracting(DriverCandidate::getDriverId).containsExactly("d3", "d4");
        assertThat(batches.hasDelayed()).isTrue();
    }

    @Test
    @DisplayName("Fewer candidates than the batch size leaves nothing delayed")
    void smallList() {
        OfferBatches batches = OfferBatches.split(drivers(2), 3);

        assertThat(batches.immediate()).hasSize(2);
        assertThat(batches.hasDelayed()).isFalse();
    }

    private static List<DriverCandidate> drivers(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> DriverCandidate.builder().driverId("d" + i).build())
                .toList();
    }
}
