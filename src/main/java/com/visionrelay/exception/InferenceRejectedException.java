package com.visionrelay.exception;

/**
 * An inference task was discarded before it ran (queue overflow, pool shut down).
 */
public class InferenceRejectedException extends RuntimeException {

    public InferenceRejectedException(String message) {
        super(message);
    }
}
