package io.trackimport.bulkload.common;

import lombok.Getter;

/**
 * A non-recoverable response from the track API, such as a malformed batch or a missing or invalid API key.
 * Fails the whole import invocation.
 */
public class FatalTrackException extends RuntimeException {
    @Getter
    private final int statusCode;

    public FatalTrackException(int statusCode, String message) {
        super(message + " (status " + statusCode + ")");
        this.statusCode = statusCode;
    }
}
