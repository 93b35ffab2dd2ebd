package com.camingest.camingest.controller;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import com.camingest.camingest.exception.CameraNotFoundException;
import com.camingest.camingest.model.dto.CameraRegistration;
import com.camingest.camingest.model.entity.Camera;
import com.camingest.camingest.service.supervisor.CameraSupervisor;
import com.camingest.camingest.service.supervisor.LiveFrameSequence;

/**
 * Camera API
 *
 * Endpoints:
 * - POST   /api/cameras                         - Register (or replace) a camera
 * - GET    /api/cameras                         - List cameras
 * - GET    /api/cameras/{id}                    - One camera
 * - DELETE /api/cameras/{id}                    - Unregister
 * - POST   /api/cameras/{id}/frames             - Push one image (http_push cameras)
 * - GET    /api/cameras/{id}/frame/latest       - Newest buffered frame as JPEG
 * - GET    /api/cameras/{id}/stream/live.mjpeg  - Live MJPEG stream
 */
@RestController
@RequestMapping("/api/cameras")
public class CameraController {

    private static final Logger logger = LoggerFactory.getLogger(CameraController.class);

    private static final String BOUNDARY = "frame";
    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private final CameraSupervisor supervisor;

    public CameraController(CameraSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @PostMapping
    public ResponseEntity<Camera> register(@RequestBody CameraRegistration registration) {
        return ResponseEntity.ok(supervisor.register(registration));
    }

    @GetMapping
    public List<Camera> list() {
        return supervisor.list();
    }

    @GetMapping("/{id}")
    public Camera get(@PathVariable String id) {
        return supervisor.get(id).orElseThrow(() -> new CameraNotFoundException(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> unregister(@PathVariable String id) {
        if (!supervisor.unregister(id)) {
            throw new CameraNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/cameras/{id}/frames?timestamp=1700000000000
     * Body: raw image bytes (JPEG, PNG, ...)
     */
    @PostMapping(value = "/{id}/frames", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, Object>> ingestFrame(@PathVariable String id,
                                                           @RequestParam(required = false) Long timestamp,
                                                           @RequestBody byte[] image) {
        supervisor.ingest(id, image, timestamp);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "accepted", "camera_id", id));
    }

    @GetMapping(value = "/{id}/frame/latest", produces = MediaType.IMAGE_JPEG_VALUE)
    public ResponseEntity<byte[]> latestFrame(@PathVariable String id) {
        if (supervisor.get(id).isEmpty()) {
            throw new CameraNotFoundException(id);
        }
        byte[] jpeg = supervisor.latestFrameJpeg(id)
                .orElseThrow(() -> new CameraNotFoundException(id, "No frame available for camera " + id));
        return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(jpeg);
    }

    @GetMapping("/{id}/stream/live.mjpeg")
    public ResponseEntity<StreamingResponseBody> liveStream(@PathVariable String id) {
        LiveFrameSequence frames = supervisor.liveFrames(id);
        StreamingResponseBody body = out -> writeMjpeg(frames, out);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("multipart/x-mixed-replace; boundary=" + BOUNDARY))
                .header("Cache-Control", "no-cache, no-store")
                .body(body);
    }

    private static void writeMjpeg(LiveFrameSequence frames, OutputStream out) throws IOException {
        logger.info("Live stream opened for {}", frames.getCameraId());
        byte[] last = null;
        try {
            while (frames.isOpen()) {
                Optional<byte[]> next = frames.next();
                if (next.isPresent()) {
                    last = next.get();
                    writePart(out, last);
                } else if (frames.isOpen()) {
                    // Idle camera: write anyway so a departed viewer fails the write
                    if (last != null) {
                        writePart(out, last);
                    } else {
                        out.write(CRLF);
                        out.flush();
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            // client went away
            logger.debug("Live stream for {} closed by client: {}", frames.getCameraId(), e.getMessage());
            return;
        }
        logger.info("Live stream for {} ended", frames.getCameraId());
    }

    private static void writePart(OutputStream out, byte[] jpeg) throws IOException {
        String header = "--" + BOUNDARY + "\r\nContent-Type: image/jpeg\r\nContent-Length: "
                + jpeg.length + "\r\n\r\n";
        out.write(header.getBytes(StandardCharsets.US_ASCII));
        out.write(jpeg);
        out.write(CRLF);
        out.flush();
    }
}
