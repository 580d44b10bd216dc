package com.constellation.starDetection;

/**
 * Thrown when an intensity field is absent or has no pixels. This is the only
 * detection failure that reaches the caller; every other degenerate case falls
 * back to a default result.
 */
public class InvalidFieldException extends RuntimeException {

    public InvalidFieldException(String message) {
        super(message);
    }
}
