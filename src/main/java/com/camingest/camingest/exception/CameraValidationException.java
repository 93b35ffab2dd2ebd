package com.camingest.camingest.exception;

/**
 * Bad registration parameters, an undecodable pushed image, or an operation
 * the camera's source kind does not support. Surfaces as HTTP 400.
 */
public class CameraValidationException extends RuntimeException {

    public CameraValidationException(String message) {
        super(message);
    }

    public CameraValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
