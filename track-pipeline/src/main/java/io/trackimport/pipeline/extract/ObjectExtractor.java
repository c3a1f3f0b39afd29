package io.trackimport.pipeline.extract;

import java.util.Iterator;

import io.trackimport.bulkload.common.TrackObject;

/**
 * Pulls whole track objects out of a chunked byte stream that starts at a confirmed offset.
 *
 * <p>Alongside the objects it counts confirmed bytes: bytes that belong to objects already handed out by
 * {@link #next()}, or to structure between objects. The running total of confirmed bytes added to the start
 * offset is always a safe place for a later invocation to resume from.
 */
public interface ObjectExtractor extends Iterator<TrackObject> {

    /** Returns the bytes confirmed since the last call and resets the counter. */
    long drainConfirmedBytes();

    /** Bytes scanned so far, confirmed or not. */
    long getScannedBytes();

    /**
     * True while objects already handed out still wait on later ones for their bytes to be confirmed.
     * Stopping at such a point would resume before objects that were already sent.
     */
    boolean hasBufferedObjects();
}
