package com.camingest.camingest.service.worker;

import java.util.Optional;

import org.bytedeco.opencv.opencv_core.Mat;

import com.camingest.camingest.model.entity.Camera;
import com.camingest.camingest.service.buffer.BufferedFrame;
import com.camingest.camingest.service.buffer.FrameRingBuffer;

/**
 * Owns one camera's frame processing and ring buffer. Pull workers also own the
 * connection and read loop; push workers are fed by the HTTP ingestion path.
 */
public abstract class CameraWorker {

    protected final Camera camera;
    protected final FrameProcessor processor;

    protected CameraWorker(Camera camera, FrameProcessor processor) {
        this.camera = camera;
        this.processor = processor;
    }

    public abstract void start();

    /**
     * Idempotent. When it returns, no frame processing for this worker is in flight.
     */
    public abstract void stop();

    public abstract boolean isRunning();

    public abstract WorkerState getState();

    /**
     * Hand one frame to the processing pipeline.
     *
     * @return false if the worker is not running and the frame was dropped
     */
    public boolean processFrame(Mat frame, long timestamp) {
        if (!isRunning()) {
            return false;
        }
        return processor.process(frame, timestamp);
    }

    public Optional<BufferedFrame> getLatestFrame() {
        return processor.getBuffer().getLatest();
    }

    public FrameRingBuffer<BufferedFrame> getBuffer() {
        return processor.getBuffer();
    }

    public FrameProcessor getProcessor() {
        return processor;
    }

    public String getCameraId() {
        return camera.getId();
    }

    public Camera getCamera() {
        return camera;
    }
}
