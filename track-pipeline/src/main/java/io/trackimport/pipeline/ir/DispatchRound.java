package io.trackimport.pipeline.ir;

import java.util.List;

import io.trackimport.bulkload.common.TrackObject;

/**
 * Up to W batches dispatched together. The final round is the one produced once the source ran out,
 * it may hold a short last batch or no batches at all.
 */
public record DispatchRound(List<List<TrackObject>> batches, boolean finalRound) {

    public int objectCount() {
        return batches.stream().mapToInt(List::size).sum();
    }
}
