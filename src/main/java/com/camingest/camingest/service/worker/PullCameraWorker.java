package com.camingest.camingest.service.worker;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.model.dto.CameraEventType;
import com.camingest.camingest.model.entity.Camera;
import com.camingest.camingest.model.entity.CameraStatus;
import com.camingest.camingest.service.events.EventPublisher;
import com.camingest.camingest.service.metrics.CameraMetrics;
import com.camingest.camingest.service.source.FFmpegFrameSourceOpener;
import com.camingest.camingest.service.source.FrameSource;
import com.camingest.camingest.service.source.FrameSourceOpener;
import com.camingest.camingest.service.source.StreamMetadata;

/**
 * Worker for rtsp, mjpeg and onvif cameras: one read-loop task on the shared worker executor.
 *
 * <pre>
 * STOPPED -> STARTING -> CONNECTING -> STREAMING -> DISCONNECTED -> CONNECTING ...
 * </pre>
 *
 * Open failures wait out the current backoff (which then doubles); read failures reconnect
 * right away. stop() closes the open source to unblock a pending read and interrupts the
 * backoff sleep.
 */
public class PullCameraWorker extends CameraWorker {

    private static final Logger logger = LoggerFactory.getLogger(PullCameraWorker.class);

    private final ExecutorService executor;
    private final FrameSourceOpener opener;
    private final ReconnectBackoff backoff;
    private final Duration errorPause;
    private final Duration stopTimeout;
    private final EventPublisher publisher;
    private final CameraMetrics metrics;
    private final Clock clock;

    private volatile WorkerState state = WorkerState.STOPPED;
    private volatile StreamMetadata metadata = StreamMetadata.unknown();

    // Guarded by this; null while stopped
    private Run run;

    public PullCameraWorker(Camera camera, FrameProcessor processor, ExecutorService executor,
                            FrameSourceOpener opener, ReconnectBackoff backoff,
                            Duration errorPause, Duration stopTimeout,
                            EventPublisher publisher, CameraMetrics metrics, Clock clock) {
        super(camera, processor);
        this.executor = executor;
        this.opener = opener;
        this.backoff = backoff;
        this.errorPause = errorPause;
        this.stopTimeout = stopTimeout;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (run != null) {
            return;
        }
        state = WorkerState.STARTING;
        processor.open();

        Run next = new Run();
        run = next;
        next.future = executor.submit(() -> runLoop(next));
        logger.info("Worker {} started for {}", camera.getId(),
                FFmpegFrameSourceOpener.redact(camera.getSourceUrl()));
    }

    @Override
    public synchronized void stop() {
        Run current = run;
        if (current == null) {
            return;
        }
        current.stopRequested = true;
        current.closeSource();
        current.future.cancel(true);

        // A task cancelled before it ran never reaches its finally block
        if (current.started.compareAndSet(false, true)) {
            current.terminated.countDown();
        }
        try {
            if (!current.terminated.await(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Worker {} did not exit within {}", camera.getId(), stopTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        // Waits out a frame still being processed, then rejects late ones
        processor.close();
        state = WorkerState.STOPPED;
        run = null;
        logger.info("Worker {} stopped", camera.getId());
    }

    @Override
    public boolean isRunning() {
        Run current = run;
        return current != null && !current.stopRequested && state != WorkerState.STOPPED;
    }

    @Override
    public WorkerState getState() {
        return state;
    }

    public ReconnectBackoff getBackoff() {
        return backoff;
    }

    public StreamMetadata getMetadata() {
        return metadata;
    }

    private void runLoop(Run current) {
        if (!current.started.compareAndSet(false, true)) {
            return;
        }
        try {
            while (!current.stopRequested) {
                try {
                    connectAndStream(current);
                } catch (InterruptedException e) {
                    break;
                } catch (Exception e) {
                    if (current.stopRequested) {
                        break;
                    }
                    logger.error("Unexpected error in worker {}", camera.getId(), e);
                    try {
                        Thread.sleep(errorPause.toMillis());
                    } catch (InterruptedException ie) {
                        break;
                    }
                }
            }
        } finally {
            current.closeSource();
            if (current.stopRequested) {
                state = WorkerState.STOPPED;
            }
            current.terminated.countDown();
        }
    }

    /**
     * One connect attempt and, if it succeeds, the read loop until the stream breaks.
     */
    private void connectAndStream(Run current) throws InterruptedException {
        state = WorkerState.CONNECTING;
        FrameSource source;
        try {
            source = opener.open(camera.getSourceUrl());
        } catch (IOException e) {
            if (current.stopRequested) {
                return;
            }
            handleDisconnect("Failed to open stream: " + e.getMessage());
            Duration delay = backoff.getCurrentDelay();
            logger.info("Worker {} retrying in {} ms", camera.getId(), delay.toMillis());
            Thread.sleep(delay.toMillis());
            backoff.increase();
            return;
        }

        current.source = source;
        try {
            // stop() may have run between open() returning and the assignment above
            if (current.stopRequested) {
                return;
            }
            backoff.reset();
            handleConnect(source.getMetadata());
            state = WorkerState.STREAMING;
            readLoop(current, source);
        } finally {
            current.closeSource();
        }
    }

    private void readLoop(Run current, FrameSource source) {
        while (!current.stopRequested) {
            Mat frame;
            try {
                frame = source.read();
            } catch (IOException e) {
                if (!current.stopRequested) {
                    handleDisconnect("Stream error: " + e.getMessage());
                }
                return;
            }
            if (frame == null) {
                if (!current.stopRequested) {
                    handleDisconnect("Stream error: end of stream");
                }
                return;
            }
            if (!processor.process(frame, clock.millis())) {
                frame.close();
            }
        }
    }

    private void handleConnect(StreamMetadata streamMetadata) {
        metadata = streamMetadata;
        camera.setStatus(CameraStatus.CONNECTED);
        metrics.updateCameraStatus(camera.getId(), true);
        logger.info("Camera {} connected: {}", camera.getId(), streamMetadata);
        publish(CameraEvent.builder(camera.getId(), CameraEventType.CAMERA_CONNECTED, clock.millis())
                .put("width", streamMetadata.getWidth())
                .put("height", streamMetadata.getHeight())
                .put("fps", streamMetadata.getFps())
                .build());
    }

    private void handleDisconnect(String reason) {
        state = WorkerState.DISCONNECTED;
        camera.setStatus(CameraStatus.DISCONNECTED);
        metrics.updateCameraStatus(camera.getId(), false);
        logger.info("Camera {} disconnected: {}", camera.getId(), reason);
        publish(CameraEvent.builder(camera.getId(), CameraEventType.CAMERA_DISCONNECTED, clock.millis())
                .put("reason", reason)
                .build());
    }

    private void publish(CameraEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            logger.warn("Publishing {} failed: {}", event, e.getMessage());
        }
    }

    /**
     * State of one start()..stop() cycle. A loop that outlives its stop timeout keeps
     * seeing its own stop flag, so a later start() never revives it.
     */
    private static final class Run {
        volatile boolean stopRequested = false;
        volatile FrameSource source;
        final AtomicBoolean started = new AtomicBoolean(false);
        final CountDownLatch terminated = new CountDownLatch(1);
        Future<?> future;

        synchronized void closeSource() {
            FrameSource open = source;
            source = null;
            if (open != null) {
                open.close();
            }
        }
    }
}
