package io.trackimport.pipeline.sink;

import java.util.List;

import io.trackimport.bulkload.common.BulkDispatcher;
import io.trackimport.bulkload.common.TrackObject;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Sends rounds to the track API through a {@link BulkDispatcher}.
 */
@RequiredArgsConstructor
public class BulkDispatchSink implements ObjectSink {
    private final BulkDispatcher dispatcher;

    @Override
    public Mono<Integer> writeRound(List<List<TrackObject>> batches) {
        return dispatcher.dispatchRound(batches);
    }
}
