package io.trackimport.pipeline.ir;

/**
 * Byte offset from which an invocation starts reading. It always points at a position outside any
 * object, so reading from it never splits or repeats a record that was already confirmed.
 */
public record ResumeCursor(long confirmedOffset) {

    public static final ResumeCursor START = new ResumeCursor(0);

    public ResumeCursor {
        if (confirmedOffset < 0) {
            throw new IllegalArgumentException("confirmedOffset must be >= 0, got " + confirmedOffset);
        }
    }

    public ResumeCursor advance(long confirmedBytes) {
        return new ResumeCursor(confirmedOffset + confirmedBytes);
    }
}
