package io.trackimport.pipeline.extract;

import lombok.Getter;

/**
 * The source is not a JSON array of objects. Fatal for the invocation.
 */
public class MalformedSourceException extends RuntimeException {
    @Getter
    private final long offset;

    public MalformedSourceException(long offset, String message) {
        super(message + " at byte " + offset);
        this.offset = offset;
    }

    public MalformedSourceException(long offset, String message, Throwable cause) {
        super(message + " at byte " + offset, cause);
        this.offset = offset;
    }
}
