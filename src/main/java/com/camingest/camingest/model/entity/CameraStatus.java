package com.camingest.camingest.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CameraStatus {
    REGISTERED,
    CONNECTED,
    DISCONNECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
