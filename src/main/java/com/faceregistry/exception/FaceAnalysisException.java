package com.faceregistry.exception;

/**
 * The external analyzer could not produce a usable result for an image.
 */
public class FaceAnalysisException extends Exception {

    public FaceAnalysisException(String message) {
        super(message);
    }

    public FaceAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
