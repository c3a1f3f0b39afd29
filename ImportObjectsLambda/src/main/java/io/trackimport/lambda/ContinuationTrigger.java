package io.trackimport.lambda;

/**
 * Schedules the next invocation of an import that ran out of time.
 */
public interface ContinuationTrigger {

    void continueFrom(ImportEvent event, long byteOffset);
}
