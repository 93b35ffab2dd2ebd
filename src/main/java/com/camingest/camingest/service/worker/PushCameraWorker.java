package com.camingest.camingest.service.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.camingest.camingest.model.entity.Camera;
import com.camingest.camingest.model.entity.CameraStatus;
import com.camingest.camingest.service.metrics.CameraMetrics;

/**
 * Worker for http_push cameras. No connection and no thread of its own:
 * it is STREAMING from start() until stop(), and frames arrive through {@link #processFrame}.
 */
public class PushCameraWorker extends CameraWorker {

    private static final Logger logger = LoggerFactory.getLogger(PushCameraWorker.class);

    private final CameraMetrics metrics;
    private volatile WorkerState state = WorkerState.STOPPED;

    public PushCameraWorker(Camera camera, FrameProcessor processor, CameraMetrics metrics) {
        super(camera, processor);
        this.metrics = metrics;
    }

    @Override
    public synchronized void start() {
        if (state != WorkerState.STOPPED) {
            return;
        }
        processor.open();
        state = WorkerState.STREAMING;
        camera.setStatus(CameraStatus.CONNECTED);
        metrics.updateCameraStatus(camera.getId(), true);
        logger.info("Push worker {} initialized.", camera.getId());
    }

    @Override
    public synchronized void stop() {
        if (state == WorkerState.STOPPED) {
            return;
        }
        state = WorkerState.STOPPED;
        processor.close();
        metrics.updateCameraStatus(camera.getId(), false);
        logger.info("Push worker {} stopped.", camera.getId());
    }

    @Override
    public boolean isRunning() {
        return state == WorkerState.STREAMING;
    }

    @Override
    public WorkerState getState() {
        return state;
    }
}
