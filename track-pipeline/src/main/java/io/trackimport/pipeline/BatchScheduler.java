package io.trackimport.pipeline;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import io.trackimport.bulkload.common.TrackObject;
import io.trackimport.pipeline.ir.DispatchRound;

/**
 * Groups objects into batches of {@code batchSize} and batches into rounds of {@code batchesPerRound}.
 * Objects are pulled only while a round is being assembled, so at most one round is held in memory.
 */
public class BatchScheduler {
    public static final int DEFAULT_BATCH_SIZE = 75;

    private final Iterator<TrackObject> objects;
    private final int batchSize;
    private final int batchesPerRound;
    private boolean exhausted;

    public BatchScheduler(Iterator<TrackObject> objects, int batchSize, int batchesPerRound) {
        if (batchSize < 1 || batchesPerRound < 1) {
            throw new IllegalArgumentException(
                "batchSize and batchesPerRound must be >= 1, got " + batchSize + " and " + batchesPerRound);
        }
        this.objects = objects;
        this.batchSize = batchSize;
        this.batchesPerRound = batchesPerRound;
    }

    /**
     * Assemble the next round. A full round is returned as soon as its last batch fills up, without looking
     * ahead in the source. Once the source runs out the remaining objects form the final round.
     */
    public DispatchRound nextRound() {
        List<List<TrackObject>> batches = new ArrayList<>(batchesPerRound);
        List<TrackObject> current = new ArrayList<>(batchSize);
        while (batches.size() < batchesPerRound) {
            if (exhausted || !objects.hasNext()) {
                exhausted = true;
                if (!current.isEmpty()) {
                    batches.add(current);
                }
                return new DispatchRound(batches, true);
            }
            current.add(objects.next());
            if (current.size() == batchSize) {
                batches.add(current);
                current = new ArrayList<>(batchSize);
            }
        }
        return new DispatchRound(batches, false);
    }
}
