package io.trackimport.pipeline.sink;

import java.util.List;

import io.trackimport.bulkload.common.TrackObject;

import reactor.core.publisher.Mono;

/**
 * Port for sending a dispatch round to any target (the track API, a test collector).
 */
public interface ObjectSink extends AutoCloseable {

    /**
     * Write all batches of one round. Emits the number of objects the target accepted, or fails with the
     * first batch failure.
     */
    Mono<Integer> writeRound(List<List<TrackObject>> batches);

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
