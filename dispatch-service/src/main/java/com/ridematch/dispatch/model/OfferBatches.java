package com.ridematch.dispatch.model;

import java.util.List;

/**
 * Candidates split into the batch offered immediately and the batch held back
 * for the retry delay.
 */
public record OfferBatches(List<DriverCandidate> immediate, List<DriverCandidate> delayed) {

    public static OfferBatches split(List<DriverCandidate> ranked, int firstBatchSize) {
        int cut = Math.max(0, Math.min(firstBatchSize, ranked.size()));
        return new OfferBatches(List.copyOf(ranked.subList(0, cut)),
                List.copyOf(ranked.subList(cut, ranked.size())));
    }

    public boolean hasDelayed() {
        return !delayed.isEmpty();
    }
}
