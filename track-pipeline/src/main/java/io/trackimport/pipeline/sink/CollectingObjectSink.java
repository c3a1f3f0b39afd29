package io.trackimport.pipeline.sink;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.trackimport.bulkload.common.TrackObject;

import reactor.core.publisher.Mono;

/**
 * Accepts every object without sending it anywhere. Used for dry runs of the local runner and for testing
 * the reading side without a remote endpoint.
 */
public class CollectingObjectSink implements ObjectSink {

    private final List<TrackObject> collectedObjects = new CopyOnWriteArrayList<>();
    private final List<Integer> batchSizes = new CopyOnWriteArrayList<>();
    private final List<Integer> roundSizes = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Integer> writeRound(List<List<TrackObject>> batches) {
        return Mono.fromCallable(() -> {
            int accepted = 0;
            for (List<TrackObject> batch : batches) {
                collectedObjects.addAll(batch);
                batchSizes.add(batch.size());
                accepted += batch.size();
            }
            roundSizes.add(accepted);
            return accepted;
        });
    }

    public List<TrackObject> getCollectedObjects() {
        return Collections.unmodifiableList(collectedObjects);
    }

    public List<Integer> getBatchSizes() {
        return Collections.unmodifiableList(batchSizes);
    }

    public List<Integer> getRoundSizes() {
        return Collections.unmodifiableList(roundSizes);
    }
}
