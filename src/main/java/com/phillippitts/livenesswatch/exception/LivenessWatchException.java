package com.phillippitts.livenesswatch.exception;

/**
 * Base exception for all livenesswatch application-specific errors.
 * Domain exceptions extend this class so the REST boundary can handle them in one place.
 */
public class LivenessWatchException extends RuntimeException {

    public LivenessWatchException(String message) {
        super(message);
    }

    public LivenessWatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
