package com.camingest.camingest.service.supervisor;

import java.time.Duration;
import java.util.Optional;

import com.camingest.camingest.service.buffer.BufferedFrame;
import com.camingest.camingest.service.worker.CameraWorker;
import com.camingest.camingest.util.JpegCodec;

/**
 * Lazy, unbounded sequence of JPEG frames from one camera's ring buffer. A frame is emitted
 * only if it is newer than the last one emitted, and never faster than the configured rate.
 * A call to {@link #next()} waits at most the keep-alive interval, so the consumer gets
 * control back regularly even while the camera produces nothing.
 * Not thread-safe: one consumer per sequence.
 */
public class LiveFrameSequence {

    private final CameraWorker worker;
    private final long intervalMillis;
    private final long keepAliveMillis;

    private long lastTimestamp = Long.MIN_VALUE;
    private long lastEmittedAt = 0;

    public LiveFrameSequence(CameraWorker worker, int maxFps, Duration keepAlive) {
        if (maxFps < 1) {
            throw new IllegalArgumentException("max fps must be at least 1: " + maxFps);
        }
        if (keepAlive == null || keepAlive.isNegative() || keepAlive.isZero()) {
            throw new IllegalArgumentException("keep-alive must be positive: " + keepAlive);
        }
        this.worker = worker;
        this.intervalMillis = Duration.ofSeconds(1).toMillis() / maxFps;
        this.keepAliveMillis = keepAlive.toMillis();
    }

    /**
     * Blocks until a newer frame is available, the keep-alive interval runs out, or the
     * worker stops. Use {@link #isOpen()} to tell the last two apart.
     *
     * @return the next encoded frame, or empty if none arrived in time
     */
    public Optional<byte[]> next() throws InterruptedException {
        long wait = lastEmittedAt + intervalMillis - System.currentTimeMillis();
        if (wait > 0) {
            Thread.sleep(wait);
        }
        long deadline = System.currentTimeMillis() + keepAliveMillis;
        while (worker.isRunning()) {
            Optional<BufferedFrame> latest = worker.getLatestFrame();
            if (latest.isPresent() && latest.get().getTimestamp() > lastTimestamp) {
                BufferedFrame frame = latest.get();
                Optional<byte[]> jpeg = JpegCodec.encode(frame.getImage());
                lastTimestamp = frame.getTimestamp();
                if (jpeg.isPresent()) {
                    lastEmittedAt = System.currentTimeMillis();
                    return jpeg;
                }
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return Optional.empty();
            }
            Thread.sleep(Math.max(1, Math.min(intervalMillis, remaining)));
        }
        return Optional.empty();
    }

    /**
     * @return false once the camera's worker has stopped; the sequence then ends
     */
    public boolean isOpen() {
        return worker.isRunning();
    }

    public String getCameraId() {
        return worker.getCameraId();
    }
}
