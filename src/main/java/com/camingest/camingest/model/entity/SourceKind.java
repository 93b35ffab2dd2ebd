package com.camingest.camingest.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a camera's frames come from.
 * rtsp / mjpeg are pulled by a worker, http_push frames are posted to us,
 * onvif cameras are resolved to a pull URL before their worker starts.
 */
public enum SourceKind {

    RTSP("rtsp"),
    MJPEG("mjpeg"),
    HTTP_PUSH("http_push"),
    ONVIF("onvif");

    private final String wireName;

    SourceKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isPush() {
        return this == HTTP_PUSH;
    }

    public boolean isDiscovered() {
        return this == ONVIF;
    }

    /**
     * Pull sources, including discovered ones once their URL is known.
     */
    public boolean isPull() {
        return this != HTTP_PUSH;
    }

    @JsonCreator
    public static SourceKind fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (SourceKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
