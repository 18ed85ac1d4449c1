package com.visionrelay.exception;

/**
 * The detector could not be loaded or failed while running a frame.
 */
public class InferenceException extends Exception {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
