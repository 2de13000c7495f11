package com.reelindex.service.inference;

/**
 * An embedding or detection collaborator could not produce a result.
 */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
