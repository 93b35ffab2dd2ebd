package com.camingest.camingest.service.supervisor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.camingest.camingest.config.CameraIngestProperties;
import com.camingest.camingest.model.entity.Camera;
import com.camingest.camingest.service.buffer.BufferedFrame;
import com.camingest.camingest.service.buffer.FrameRingBuffer;
import com.camingest.camingest.service.events.EventPublisher;
import com.camingest.camingest.service.inference.InferenceEngine;
import com.camingest.camingest.service.inference.SnapshotStore;
import com.camingest.camingest.service.metrics.CameraMetrics;
import com.camingest.camingest.service.motion.MotionDetector;
import com.camingest.camingest.service.source.FrameSourceOpener;
import com.camingest.camingest.service.worker.CameraWorker;
import com.camingest.camingest.service.worker.FrameGateState;
import com.camingest.camingest.service.worker.FrameProcessor;
import com.camingest.camingest.service.worker.PullCameraWorker;
import com.camingest.camingest.service.worker.PushCameraWorker;
import com.camingest.camingest.service.worker.ReconnectBackoff;

/**
 * Builds a fresh, unstarted worker for a camera: its own ring buffer, gate state,
 * motion detector and backoff, wired to the shared collaborators.
 */
@Component
public class WorkerFactory {

    private final CameraIngestProperties properties;
    private final ExecutorService executor;
    private final FrameSourceOpener opener;
    private final InferenceEngine inferenceEngine;
    private final SnapshotStore snapshotStore;
    private final EventPublisher publisher;
    private final CameraMetrics metrics;
    private final Clock clock;

    public WorkerFactory(CameraIngestProperties properties,
                         @Qualifier("cameraWorkerExecutor") ExecutorService executor,
                         FrameSourceOpener opener, InferenceEngine inferenceEngine,
                         SnapshotStore snapshotStore, EventPublisher publisher,
                         CameraMetrics metrics, Clock clock) {
        this.properties = properties;
        this.executor = executor;
        this.opener = opener;
        this.inferenceEngine = inferenceEngine;
        this.snapshotStore = snapshotStore;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    public CameraWorker create(Camera camera) {
        FrameProcessor processor = newProcessor(camera);
        if (camera.getSourceType().isPush()) {
            return new PushCameraWorker(camera, processor, metrics);
        }
        CameraIngestProperties.Reconnect reconnect = properties.getReconnect();
        return new PullCameraWorker(camera, processor, executor, opener,
                new ReconnectBackoff(reconnect.getInitialDelay(), reconnect.getMaxDelay()),
                reconnect.getErrorPause(), reconnect.getStopTimeout(),
                publisher, metrics, clock);
    }

    private FrameProcessor newProcessor(Camera camera) {
        CameraIngestProperties.Motion motion = properties.getMotion();
        CameraIngestProperties.Inference inference = properties.getInference();

        MotionDetector detector = motion.isEnabled()
                ? new MotionDetector(motion.getMinArea(), motion.getPixelThreshold(), motion.getBlurKernel(),
                        motion.getDilateIterations(), motion.getCooldown(), clock)
                : null;

        return FrameProcessor.builder()
                .cameraId(camera.getId())
                .source(camera.getSourceType())
                .buffer(new FrameRingBuffer<BufferedFrame>(properties.getBufferCapacity()))
                .gate(new FrameGateState(motion.getFrameSkip(), properties.getFrameEventInterval(),
                        inference.getTriggerCooldown(), inference.getPersonCooldown()))
                .motionDetector(detector)
                .inferenceEngine(inferenceEngine)
                .snapshotStore(snapshotStore)
                .targetLabel(inference.getLabel())
                .confidenceThreshold(inference.getConfidenceThreshold())
                .publisher(publisher)
                .metrics(metrics)
                .clock(clock)
                .build();
    }
}
