package io.trackimport.bulkload.common;

import lombok.Getter;

/**
 * A transient failure (throttling or a server error). The same batch may be sent again after a delay.
 */
public class RetryableTrackException extends RuntimeException {
    @Getter
    private final int statusCode;

    public RetryableTrackException(int statusCode, String message) {
        super(message + " (status " + statusCode + ")");
        this.statusCode = statusCode;
    }
}
