package io.trackimport.pipeline;

import io.trackimport.pipeline.ir.ResumeCursor;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Confirmed offset and processed-object count of one invocation. Only advanced after a round was dispatched
 * successfully.
 */
@Slf4j
public class ProgressTracker {
    @Getter
    private ResumeCursor cursor;
    @Getter
    private long processedObjects;

    public ProgressTracker(ResumeCursor start) {
        this.cursor = start;
    }

    public void advance(long confirmedBytes, long objectsSent) {
        cursor = cursor.advance(confirmedBytes);
        processedObjects += objectsSent;
    }

    public long getConfirmedOffset() {
        return cursor.confirmedOffset();
    }

    /**
     * Finished when the offset reached the end of the blob, when it is still 0, or when nothing was processed
     * in this invocation. The last case also stops a resumed import whose remaining bytes hold no objects.
     */
    public boolean isFinished(long totalLength) {
        long offset = cursor.confirmedOffset();
        boolean finished = processedObjects == 0 || offset == 0 || offset >= totalLength;
        if (finished && offset < totalLength && offset > 0) {
            log.warn("No objects were processed, treating import as finished at byte {} of {}",
                offset, totalLength);
        }
        return finished;
    }
}
