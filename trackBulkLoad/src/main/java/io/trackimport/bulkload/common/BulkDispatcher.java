package io.trackimport.bulkload.common;

import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Sends the batches of one dispatch round concurrently, at most {@code maxConcurrentBatches} at a time.
 * Each batch retries independently inside {@link TrackClient}. The round emits the total number of
 * processed objects, or fails with the first batch failure, cancelling the batches still in flight.
 */
@Slf4j
@RequiredArgsConstructor
public class BulkDispatcher {
    private final TrackClient client;
    private final int maxConcurrentBatches;

    public Mono<Integer> dispatchRound(List<List<TrackObject>> batches) {
        return Flux.fromIterable(batches)
            .flatMap(
                batch -> client.sendTrackRequest(batch)
                    .doFirst(() -> log.debug("{} objects in current track request.", batch.size()))
                    .doOnSuccess(sent -> log.debug("Batch succeeded, {} objects processed", sent))
                    .doOnError(error -> log.error("Batch of {} objects failed", batch.size(), error)),
                maxConcurrentBatches
            )
            .reduce(0, Integer::sum)
            .doOnNext(sent -> {
                if (sent > 0) {
                    log.info("Successfully sent {} objects", sent);
                }
            });
    }
}
