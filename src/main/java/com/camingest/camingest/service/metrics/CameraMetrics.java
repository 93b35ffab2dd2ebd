package com.camingest.camingest.service.metrics;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Per-camera ingest metrics. Exported by the Prometheus registry as
 * camera_ingest_status, camera_ingest_frames_total, camera_ingest_motion_total
 * and camera_ingest_last_frame_timestamp.
 */
public class CameraMetrics {

    public static final String STATUS = "camera_ingest_status";
    public static final String FRAMES = "camera_ingest_frames";
    public static final String MOTION = "camera_ingest_motion";
    public static final String LAST_FRAME = "camera_ingest_last_frame_timestamp";
    public static final String EVENTS_DROPPED = "camera_ingest_events_dropped";
    public static final String SINK_FAILURES = "camera_ingest_sink_failures";

    private final MeterRegistry registry;

    // Gauges read these holders; registering once per camera keeps them alive
    private final Map<String, AtomicInteger> status = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> lastFrameMillis = new ConcurrentHashMap<>();

    public CameraMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void updateCameraStatus(String cameraId, boolean connected) {
        status.computeIfAbsent(cameraId, id -> {
            AtomicInteger holder = new AtomicInteger();
            Gauge.builder(STATUS, holder, AtomicInteger::get)
                    .description("Current connection status of the camera (0=disconnected, 1=connected)")
                    .tag("camera_id", id)
                    .register(registry);
            return holder;
        }).set(connected ? 1 : 0);
    }

    public void incrementFramesIngested(String cameraId, String sourceType) {
        Counter.builder(FRAMES)
                .description("Total number of frames ingested from all sources")
                .tags("camera_id", cameraId, "source_type", sourceType)
                .register(registry)
                .increment();
    }

    public void incrementMotionDetected(String cameraId) {
        Counter.builder(MOTION)
                .description("Total number of motion detection events")
                .tag("camera_id", cameraId)
                .register(registry)
                .increment();
    }

    public void updateLastFrameTimestamp(String cameraId, long epochMillis) {
        lastFrameMillis.computeIfAbsent(cameraId, id -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder(LAST_FRAME, holder, h -> h.get() / 1000.0)
                    .description("Unix timestamp of the last ingested frame")
                    .tag("camera_id", id)
                    .register(registry);
            return holder;
        }).set(epochMillis);
    }

    public void incrementEventsDropped() {
        registry.counter(EVENTS_DROPPED).increment();
    }

    public void incrementSinkFailures(String sink) {
        registry.counter(SINK_FAILURES, "sink", sink).increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
