package com.camingest.camingest.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Getter;
import lombok.Setter;

/**
 * A registered camera. Connection fields are fixed at registration; only the
 * status changes afterwards, driven by the camera's worker.
 */
@Getter
public class Camera {

    private final String id;

    @JsonProperty("source_type")
    private final SourceKind sourceType;

    /** Resolved stream URL for pull and discovered cameras, null for push cameras. */
    @JsonProperty("source_url")
    private final String sourceUrl;

    @JsonProperty("ip_address")
    private final String ipAddress;

    @JsonProperty("onvif_port")
    private final Integer onvifPort;

    private final String username;

    @JsonIgnore
    private final String password;

    @Setter
    private volatile CameraStatus status = CameraStatus.REGISTERED;

    public Camera(String id, SourceKind sourceType, String sourceUrl,
                  String ipAddress, Integer onvifPort, String username, String password) {
        this.id = id;
        this.sourceType = sourceType;
        this.sourceUrl = sourceUrl;
        this.ipAddress = ipAddress;
        this.onvifPort = onvifPort;
        this.username = username;
        this.password = password;
    }

    public static Camera push(String id) {
        return new Camera(id, SourceKind.HTTP_PUSH, null, null, null, null, null);
    }

    public static Camera pull(String id, SourceKind kind, String url) {
        return new Camera(id, kind, url, null, null, null, null);
    }
}
