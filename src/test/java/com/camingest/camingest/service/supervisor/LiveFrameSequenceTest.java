package com.camingest.camingest.service.supervisor;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.camingest.camingest.model.entity.Camera;
import com.camingest.camingest.service.buffer.FrameRingBuffer;
import com.camingest.camingest.service.inference.NoOpInferenceEngine;
import com.camingest.camingest.service.inference.SnapshotStore;
import com.camingest.camingest.service.metrics.CameraMetrics;
import com.camingest.camingest.service.worker.FrameGateState;
import com.camingest.camingest.service.worker.FrameProcessor;
import com.camingest.camingest.service.worker.PushCameraWorker;
import com.camingest.camingest.support.Frames;
import com.camingest.camingest.support.RecordingEventPublisher;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class LiveFrameSequenceTest {

    @TempDir
    Path snapshots;

    private PushCameraWorker worker;

    @BeforeEach
    void setUp() {
        Camera camera = Camera.push("door");
        CameraMetrics metrics = new CameraMetrics(new SimpleMeterRegistry());
        FrameProcessor processor = FrameProcessor.builder()
                .cameraId("door")
                .source(camera.getSourceType())
                .buffer(new FrameRingBuffer<>(10))
                .gate(new FrameGateState(5, Duration.ofSeconds(1), Duration.ofSeconds(3), Duration.ofSeconds(10)))
                .inferenceEngine(new NoOpInferenceEngine())
                .snapshotStore(new SnapshotStore(snapshots))
                .targetLabel("person")
                .confidenceThreshold(0.65)
                .publisher(new RecordingEventPublisher())
                .metrics(metrics)
                .clock(Clock.systemUTC())
                .build();
        worker = new PushCameraWorker(camera, processor, metrics);
        worker.start();
    }

    @Test
    void emitsOnlyNewerFramesAndEndsWhenTheWorkerStops() throws Exception {
        LiveFrameSequence frames = new LiveFrameSequence(worker, 100, Duration.ofSeconds(5));
        worker.processFrame(Frames.black(), 1_000);

        assertTrue(frames.next().isPresent());

        // Same frame again is not re-emitted: the call waits for a newer one
        CompletableFuture<Optional<byte[]>> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return frames.next();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        assertFalse(pending.isDone());

        worker.processFrame(Frames.withSquare(10, 10, 50), 2_000);
        assertTrue(pending.get(5, TimeUnit.SECONDS).isPresent());

        worker.stop();
        assertTrue(frames.next().isEmpty());
        assertFalse(frames.isOpen());
    }

    @Test
    void idleCameraHandsControlBackAfterTheKeepAlive() throws Exception {
        LiveFrameSequence frames = new LiveFrameSequence(worker, 100, Duration.ofMillis(150));
        worker.processFrame(Frames.black(), 1_000);
        assertTrue(frames.next().isPresent());

        long started = System.nanoTime();
        assertTrue(frames.next().isEmpty());
        long waited = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertTrue(waited >= 100, "returned after " + waited + "ms");
        assertTrue(waited < 2_000, "returned after " + waited + "ms");
        assertTrue(frames.isOpen());
    }

    @Test
    void paceIsCappedAtTheConfiguredRate() throws Exception {
        LiveFrameSequence frames = new LiveFrameSequence(worker, 10, Duration.ofSeconds(5));
        worker.processFrame(Frames.black(), 1);
        frames.next();
        worker.processFrame(Frames.black(), 2);

        long started = System.nanoTime();
        frames.next();
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) >= 80);
    }

    @Test
    void rejectsNonPositiveSettings() {
        assertThrows(IllegalArgumentException.class, () -> new LiveFrameSequence(worker, 0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new LiveFrameSequence(worker, 10, Duration.ZERO));
    }
}
