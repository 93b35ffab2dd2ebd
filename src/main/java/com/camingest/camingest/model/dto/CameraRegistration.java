package com.camingest.camingest.model.dto;

import com.camingest.camingest.model.entity.SourceKind;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

//Registration request body for POST /api/cameras
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class CameraRegistration {

    private String id;

    @JsonProperty("source_type")
    @JsonAlias("sourceType")
    private SourceKind sourceType;

    // rtsp / mjpeg
    @JsonProperty("source_url")
    @JsonAlias("sourceUrl")
    private String sourceUrl;

    // onvif
    @JsonProperty("ip_address")
    @JsonAlias("ipAddress")
    private String ipAddress;

    @JsonProperty("onvif_port")
    @JsonAlias("onvifPort")
    @Builder.Default
    private int onvifPort = 80;

    private String username;
    private String password;
}
