package com.camingest.camingest.service.worker;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.model.dto.CameraEventType;
import com.camingest.camingest.model.entity.SourceKind;
import com.camingest.camingest.service.buffer.BufferedFrame;
import com.camingest.camingest.service.buffer.FrameRingBuffer;
import com.camingest.camingest.service.events.EventPublisher;
import com.camingest.camingest.service.inference.Detection;
import com.camingest.camingest.service.inference.InferenceEngine;
import com.camingest.camingest.service.inference.SnapshotStore;
import com.camingest.camingest.service.metrics.CameraMetrics;
import com.camingest.camingest.service.motion.MotionDetector;

import lombok.Builder;

/**
 * What happens to every frame of one camera, whether it was pulled by a worker or pushed over HTTP:
 * buffer it, count it, publish a throttled frame.ingested event, and on sampled frames run motion
 * detection, which may escalate to inference and a person.detected alert.
 *
 * Calls are serialized per camera. After {@link #close()} returns no call is in flight and
 * further calls are rejected until {@link #open()}.
 */
public class FrameProcessor {

    private static final Logger logger = LoggerFactory.getLogger(FrameProcessor.class);

    private final String cameraId;
    private final SourceKind source;
    private final FrameRingBuffer<BufferedFrame> buffer;
    private final FrameGateState gate;
    private final MotionDetector motionDetector;
    private final InferenceEngine inferenceEngine;
    private final SnapshotStore snapshotStore;
    private final String targetLabel;
    private final double confidenceThreshold;
    private final EventPublisher publisher;
    private final CameraMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private boolean open = true;

    /**
     * @param motionDetector null disables motion analysis and inference for this camera
     */
    @Builder
    public FrameProcessor(String cameraId, SourceKind source, FrameRingBuffer<BufferedFrame> buffer,
                          FrameGateState gate, MotionDetector motionDetector,
                          InferenceEngine inferenceEngine, SnapshotStore snapshotStore,
                          String targetLabel, double confidenceThreshold,
                          EventPublisher publisher, CameraMetrics metrics, Clock clock) {
        this.cameraId = cameraId;
        this.source = source;
        this.buffer = buffer;
        this.gate = gate;
        this.motionDetector = motionDetector;
        this.inferenceEngine = inferenceEngine;
        this.snapshotStore = snapshotStore;
        this.targetLabel = targetLabel;
        this.confidenceThreshold = confidenceThreshold;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @param frame     BGR frame; ownership passes to the ring buffer, the caller must not modify it afterwards
     * @param timestamp capture time, epoch millis
     * @return false if the processor is closed and the frame was dropped
     */
    public boolean process(Mat frame, long timestamp) {
        lock.lock();
        try {
            if (!open) {
                return false;
            }
            handle(frame, timestamp);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for an in-flight call to finish, then rejects new ones.
     */
    public void close() {
        lock.lock();
        try {
            open = false;
        } finally {
            lock.unlock();
        }
    }

    public void open() {
        lock.lock();
        try {
            open = true;
        } finally {
            lock.unlock();
        }
    }

    public FrameRingBuffer<BufferedFrame> getBuffer() {
        return buffer;
    }

    public FrameGateState getGate() {
        return gate;
    }

    public SourceKind getSource() {
        return source;
    }

    private void handle(Mat frame, long timestamp) {
        buffer.put(new BufferedFrame(frame, timestamp, source));
        metrics.incrementFramesIngested(cameraId, source.getWireName());
        metrics.updateLastFrameTimestamp(cameraId, timestamp);

        long now = clock.millis();
        if (gate.tryAcquireFrameEvent(now)) {
            publish(CameraEvent.builder(cameraId, CameraEventType.FRAME_INGESTED, timestamp)
                    .put("timestamp", timestamp)
                    .put("source", source.getWireName())
                    .build());
        }

        if (motionDetector == null || !gate.shouldCheckMotion(now)) {
            return;
        }
        if (!motionDetector.detect(frame)) {
            return;
        }

        gate.startInferenceCooldown(now);
        metrics.incrementMotionDetected(cameraId);
        publish(CameraEvent.builder(cameraId, CameraEventType.MOTION_DETECTED, now)
                .put("timestamp", timestamp)
                .build());
        logger.debug("Significant motion detected on {}", cameraId);

        if (gate.isPersonCooldownActive(now)) {
            return;
        }
        try (Mat copy = frame.clone()) {
            runInference(copy, now);
        }
    }

    private void runInference(Mat copy, long now) {
        List<Detection> hits = detectionsOfInterest(copy);
        if (hits.isEmpty()) {
            return;
        }
        gate.startPersonCooldown(now);

        String framePath = null;
        try {
            Path saved = snapshotStore.saveAlertFrame(cameraId, copy, hits);
            framePath = saved.toString();
        } catch (Exception e) {
            logger.warn("Could not save alert frame for {}: {}", cameraId, e.getMessage());
        }

        publish(CameraEvent.builder(cameraId, CameraEventType.PERSON_DETECTED, now)
                .put("timestamp", now)
                .put("person_count", hits.size())
                .put("frame_path", framePath)
                .build());
        logger.info("{} {}(s) detected on {}, event published", hits.size(), targetLabel, cameraId);
    }

    // Inference failures count as "nothing found"
    private List<Detection> detectionsOfInterest(Mat copy) {
        List<Detection> detections;
        try {
            detections = inferenceEngine.infer(copy);
        } catch (Exception e) {
            logger.warn("Inference failed on {}: {}", cameraId, e.getMessage());
            return Collections.emptyList();
        }
        if (detections == null) {
            return Collections.emptyList();
        }
        return detections.stream()
                .filter(d -> targetLabel.equals(d.getLabel()) && d.getConfidence() >= confidenceThreshold)
                .collect(Collectors.toList());
    }

    private void publish(CameraEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            logger.warn("Publishing {} failed: {}", event, e.getMessage());
        }
    }
}
