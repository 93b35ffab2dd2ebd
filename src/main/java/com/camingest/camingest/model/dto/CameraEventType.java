package com.camingest.camingest.model.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CameraEventType {

    CAMERA_CONNECTED("camera.connected"),
    CAMERA_DISCONNECTED("camera.disconnected"),
    FRAME_INGESTED("frame.ingested"),
    MOTION_DETECTED("motion.detected"),
    PERSON_DETECTED("person.detected");

    private final String wireName;

    CameraEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
