package com.camingest.camingest.model.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Getter;

//Event published on camera:<id> channels (dashboard socket, kafka, notifier)
@Getter
public class CameraEvent {

    private static final String CHANNEL_PREFIX = "camera:";

    private final String channel;

    @JsonProperty("event_type")
    private final CameraEventType type;

    /** epoch millis */
    private final long timestamp;

    private final Map<String, Object> data;

    private CameraEvent(String channel, CameraEventType type, long timestamp, Map<String, Object> data) {
        this.channel = channel;
        this.type = type;
        this.timestamp = timestamp;
        this.data = Collections.unmodifiableMap(data);
    }

    public static String channelFor(String cameraId) {
        return CHANNEL_PREFIX + cameraId;
    }

    public static Builder builder(String cameraId, CameraEventType type, long timestamp) {
        return new Builder(cameraId, type, timestamp);
    }

    @JsonIgnore
    public String getCameraId() {
        return (String) data.get("camera_id");
    }

    @Override
    public String toString() {
        return type.getWireName() + "@" + channel + data;
    }

    public static final class Builder {
        private final String cameraId;
        private final CameraEventType type;
        private final long timestamp;
        private final Map<String, Object> data = new LinkedHashMap<>();

        private Builder(String cameraId, CameraEventType type, long timestamp) {
            this.cameraId = cameraId;
            this.type = type;
            this.timestamp = timestamp;
            data.put("camera_id", cameraId);
        }

        public Builder put(String key, Object value) {
            data.put(key, value);
            return this;
        }

        public CameraEvent build() {
            return new CameraEvent(channelFor(cameraId), type, timestamp, data);
        }
    }
}
