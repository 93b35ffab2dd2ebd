package com.camingest.camingest.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.model.dto.CameraEventType;
import com.camingest.camingest.model.dto.CameraRegistration;
import com.camingest.camingest.model.entity.Camera;
import com.camingest.camingest.model.entity.SourceKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class CameraWireFormatTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void registrationAcceptsSnakeAndCamelCase() throws Exception {
        CameraRegistration snake = objectMapper.readValue(
                "{\"id\":\"a\",\"source_type\":\"onvif\",\"ip_address\":\"10.0.0.1\",\"onvif_port\":8080}",
                CameraRegistration.class);
        assertEquals(SourceKind.ONVIF, snake.getSourceType());
        assertEquals("10.0.0.1", snake.getIpAddress());
        assertEquals(8080, snake.getOnvifPort());

        CameraRegistration camel = objectMapper.readValue(
                "{\"id\":\"b\",\"sourceType\":\"RTSP\",\"sourceUrl\":\"rtsp://x\"}", CameraRegistration.class);
        assertEquals(SourceKind.RTSP, camel.getSourceType());
        assertEquals("rtsp://x", camel.getSourceUrl());
        assertEquals(80, camel.getOnvifPort());
    }

    @Test
    void cameraJsonHidesThePassword() throws Exception {
        Camera camera = new Camera("gate", SourceKind.ONVIF, "rtsp://h/", "h", 80, "admin", "secret");
        JsonNode json = objectMapper.valueToTree(camera);

        assertEquals("onvif", json.get("source_type").asText());
        assertEquals("registered", json.get("status").asText());
        assertFalse(json.has("password"));
    }

    @Test
    void eventCarriesChannelTypeAndCameraId() {
        CameraEvent event = CameraEvent.builder("cam-7", CameraEventType.PERSON_DETECTED, 5L)
                .put("person_count", 3)
                .build();
        JsonNode json = objectMapper.valueToTree(event);

        assertEquals("camera:cam-7", json.get("channel").asText());
        assertEquals("person.detected", json.get("event_type").asText());
        assertEquals(5L, json.get("timestamp").asLong());
        assertEquals("cam-7", json.get("data").get("camera_id").asText());
        assertEquals(3, json.get("data").get("person_count").asInt());
        assertThrows(UnsupportedOperationException.class, () -> event.getData().put("x", 1));
    }
}
