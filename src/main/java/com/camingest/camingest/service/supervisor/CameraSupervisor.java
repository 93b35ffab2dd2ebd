package com.camingest.camingest.service.supervisor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.camingest.camingest.config.CameraIngestProperties;
import com.camingest.camingest.exception.CameraNotFoundException;
import com.camingest.camingest.exception.CameraValidationException;
import com.camingest.camingest.model.dto.CameraRegistration;
import com.camingest.camingest.model.entity.Camera;
import com.camingest.camingest.model.entity.CameraStatus;
import com.camingest.camingest.model.entity.SourceKind;
import com.camingest.camingest.service.metrics.CameraMetrics;
import com.camingest.camingest.service.source.StreamDiscovery;
import com.camingest.camingest.service.worker.CameraWorker;
import com.camingest.camingest.util.JpegCodec;

import jakarta.annotation.PreDestroy;

/**
 * Registry of cameras and their workers.
 *
 * Every mutation for one camera id runs under that id's lock stripe, so a register racing
 * an unregister (or another register) for the same id never leaves two live workers or a
 * dangling entry. Ids sharing a stripe only wait on each other. Lookups are lock-free.
 */
@Service
public class CameraSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(CameraSupervisor.class);

    static final int LOCK_STRIPES = 64;

    private final WorkerFactory workerFactory;
    private final StreamDiscovery discovery;
    private final CameraMetrics metrics;
    private final CameraIngestProperties properties;

    private final Map<String, Camera> cameras = new ConcurrentHashMap<>();
    private final Map<String, CameraWorker> workers = new ConcurrentHashMap<>();
    // Fixed set, so churn through many ids never grows it
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public CameraSupervisor(WorkerFactory workerFactory, StreamDiscovery discovery,
                            CameraMetrics metrics, CameraIngestProperties properties) {
        this.workerFactory = workerFactory;
        this.discovery = discovery;
        this.metrics = metrics;
        this.properties = properties;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Register a camera and start its worker. An existing camera with the same id is
     * stopped and replaced.
     *
     * @throws CameraValidationException if the connection parameters do not fit the source kind
     */
    public Camera register(CameraRegistration registration) {
        Camera camera = toCamera(registration);
        String id = camera.getId();

        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            CameraWorker previous = workers.remove(id);
            if (previous != null) {
                logger.info("Replacing camera {}", id);
                previous.stop();
            }
            CameraWorker worker = workerFactory.create(camera);
            cameras.put(id, camera);
            workers.put(id, worker);
            worker.start();
        } finally {
            lock.unlock();
        }
        logger.info("Camera {} registered ({})", id, camera.getSourceType().getWireName());
        return camera;
    }

    /**
     * Stop the camera's worker and forget the camera.
     *
     * @return false if no camera with that id was registered
     */
    public boolean unregister(String id) {
        if (id == null) {
            return false;
        }
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            CameraWorker worker = workers.remove(id);
            if (worker != null) {
                worker.stop();
            }
            Camera camera = cameras.remove(id);
            if (camera == null) {
                return false;
            }
            camera.setStatus(CameraStatus.DISCONNECTED);
            metrics.updateCameraStatus(id, false);
        } finally {
            lock.unlock();
        }
        logger.info("Camera {} unregistered", id);
        return true;
    }

    public Optional<Camera> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(cameras.get(id));
    }

    public List<Camera> list() {
        List<Camera> all = new ArrayList<>(cameras.values());
        all.sort(Comparator.comparing(Camera::getId));
        return all;
    }

    public Optional<CameraWorker> getWorker(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(workers.get(id));
    }

    /**
     * Push ingestion: decode one posted image and hand it to the camera's worker.
     *
     * @param timestamp capture time in epoch millis, or null for "now"
     * @throws CameraNotFoundException   if the camera is unknown or no longer accepting frames
     * @throws CameraValidationException if the camera is not a push camera or the image cannot be decoded
     */
    public void ingest(String id, byte[] image, Long timestamp) {
        Camera camera = get(id).orElseThrow(() -> new CameraNotFoundException(id));
        if (camera.getSourceType() != SourceKind.HTTP_PUSH) {
            throw new CameraValidationException("Camera " + id + " is not an http_push camera");
        }
        CameraWorker worker = getWorker(id).orElseThrow(() -> new CameraNotFoundException(id));

        Mat frame = JpegCodec.decode(image)
                .orElseThrow(() -> new CameraValidationException("Invalid image data"));
        long ts = timestamp != null ? timestamp : System.currentTimeMillis();
        if (!worker.processFrame(frame, ts)) {
            frame.close();
            throw new CameraNotFoundException(id, "Camera " + id + " is not accepting frames");
        }
    }

    /**
     * On-demand read of the newest buffered frame, JPEG-encoded.
     */
    public Optional<byte[]> latestFrameJpeg(String id) {
        return getWorker(id)
                .flatMap(CameraWorker::getLatestFrame)
                .flatMap(frame -> JpegCodec.encode(frame.getImage()));
    }

    /**
     * @throws CameraNotFoundException if the camera has no running worker
     */
    public LiveFrameSequence liveFrames(String id) {
        CameraWorker worker = getWorker(id)
                .filter(CameraWorker::isRunning)
                .orElseThrow(() -> new CameraNotFoundException(id, "Camera " + id + " is not streaming"));
        CameraIngestProperties.Live live = properties.getLive();
        return new LiveFrameSequence(worker, live.getMaxFps(), live.getKeepAlive());
    }

    @PreDestroy
    public void stopAll() {
        logger.info("Stopping {} camera worker(s)", workers.size());
        for (String id : new ArrayList<>(workers.keySet())) {
            ReentrantLock lock = lockFor(id);
            lock.lock();
            try {
                CameraWorker worker = workers.remove(id);
                if (worker != null) {
                    worker.stop();
                }
            } catch (RuntimeException e) {
                logger.error("Error stopping worker {}", id, e);
            } finally {
                lock.unlock();
            }
        }
    }

    ReentrantLock lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), locks.length)];
    }

    private Camera toCamera(CameraRegistration registration) {
        if (registration == null) {
            throw new CameraValidationException("Registration body is required");
        }
        String id = registration.getId();
        if (id == null || id.isBlank()) {
            throw new CameraValidationException("Camera id is required");
        }
        SourceKind kind = registration.getSourceType();
        if (kind == null) {
            throw new CameraValidationException("source_type is required");
        }

        switch (kind) {
            case HTTP_PUSH:
                return Camera.push(id);
            case RTSP:
            case MJPEG:
                if (isBlank(registration.getSourceUrl())) {
                    throw new CameraValidationException("source_url is required for " + kind.getWireName());
                }
                return Camera.pull(id, kind, registration.getSourceUrl().trim());
            case ONVIF:
                String url;
                try {
                    url = discovery.resolveStreamUrl(registration);
                } catch (IllegalArgumentException e) {
                    throw new CameraValidationException(e.getMessage(), e);
                }
                return new Camera(id, kind, url, registration.getIpAddress(), registration.getOnvifPort(),
                        registration.getUsername(), registration.getPassword());
            default:
                throw new CameraValidationException("Unsupported source_type: " + kind.getWireName());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
