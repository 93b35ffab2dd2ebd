package com.camingest.camingest.exception;

public class CameraNotFoundException extends RuntimeException {

    private final String cameraId;

    public CameraNotFoundException(String cameraId) {
        super("Camera not found: " + cameraId);
        this.cameraId = cameraId;
    }

    public CameraNotFoundException(String cameraId, String message) {
        super(message);
        this.cameraId = cameraId;
    }

    public String getCameraId() {
        return cameraId;
    }
}
