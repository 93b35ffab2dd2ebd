package com.camingest.camingest.controller;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import java.awt.image.BufferedImage;
import javax.imageio.ImageIO;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import com.camingest.camingest.config.CameraIngestProperties;
import com.camingest.camingest.service.inference.NoOpInferenceEngine;
import com.camingest.camingest.service.inference.SnapshotStore;
import com.camingest.camingest.service.metrics.CameraMetrics;
import com.camingest.camingest.service.source.TemplateStreamDiscovery;
import com.camingest.camingest.service.supervisor.CameraSupervisor;
import com.camingest.camingest.service.supervisor.WorkerFactory;
import com.camingest.camingest.support.RecordingEventPublisher;
import com.camingest.camingest.support.ScriptedFrameSourceOpener;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class CameraControllerTest {

    @TempDir
    Path snapshots;

    private ExecutorService executor;
    private CameraSupervisor supervisor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        CameraIngestProperties properties = new CameraIngestProperties();
        properties.getLive().setKeepAlive(Duration.ofMillis(100));
        CameraMetrics metrics = new CameraMetrics(new SimpleMeterRegistry());
        executor = Executors.newCachedThreadPool();
        WorkerFactory factory = new WorkerFactory(properties, executor, new ScriptedFrameSourceOpener(),
                new NoOpInferenceEngine(), new SnapshotStore(snapshots), new RecordingEventPublisher(),
                metrics, Clock.systemUTC());
        supervisor = new CameraSupervisor(factory,
                new TemplateStreamDiscovery(properties.getDiscovery().getUrlTemplate(), 554), metrics, properties);

        mockMvc = MockMvcBuilders
                .standaloneSetup(new CameraController(supervisor), new HealthController())
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        supervisor.stopAll();
        executor.shutdownNow();
    }

    private static byte[] jpeg() throws Exception {
        BufferedImage image = new BufferedImage(32, 24, BufferedImage.TYPE_3BYTE_BGR);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "jpg", out);
        return out.toByteArray();
    }

    private void registerPushCamera(String id) throws Exception {
        mockMvc.perform(post("/api/cameras")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"" + id + "\",\"source_type\":\"http_push\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("camera-ingest-module"));
    }

    @Test
    void registerListAndGet() throws Exception {
        mockMvc.perform(post("/api/cameras")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"yard\",\"source_type\":\"rtsp\","
                                + "\"source_url\":\"rtsp://u:p@10.0.0.2/s\",\"password\":\"p\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("yard"))
                .andExpect(jsonPath("$.source_type").value("rtsp"))
                .andExpect(jsonPath("$.password").doesNotExist());

        registerPushCamera("door");

        mockMvc.perform(get("/api/cameras"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("door"))
                .andExpect(jsonPath("$[0].status").value("connected"));

        mockMvc.perform(get("/api/cameras/door"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source_type").value("http_push"));
        mockMvc.perform(get("/api/cameras/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", containsString("nope")));
    }

    @Test
    void badRegistrationsAreRejected() throws Exception {
        mockMvc.perform(post("/api/cameras")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"yard\",\"source_type\":\"rtsp\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("source_url")));

        mockMvc.perform(post("/api/cameras")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"yard\",\"source_type\":\"webrtc\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void pushedFrameBecomesTheLatestFrame() throws Exception {
        registerPushCamera("door");

        mockMvc.perform(get("/api/cameras/door/frame/latest"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/cameras/door/frames")
                        .param("timestamp", "1700000000000")
                        .contentType(MediaType.IMAGE_JPEG)
                        .content(jpeg()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"));

        mockMvc.perform(get("/api/cameras/door/frame/latest"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_JPEG));
    }

    @Test
    void pushErrors() throws Exception {
        mockMvc.perform(post("/api/cameras/ghost/frames")
                        .contentType(MediaType.IMAGE_JPEG)
                        .content(jpeg()))
                .andExpect(status().isNotFound());

        registerPushCamera("door");
        mockMvc.perform(post("/api/cameras/door/frames")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[] {0, 1, 2, 3}))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid image data"));
    }

    @Test
    void unregister() throws Exception {
        registerPushCamera("door");

        mockMvc.perform(delete("/api/cameras/door"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/cameras/door"))
                .andExpect(status().isNotFound());
    }

    @Test
    void liveStreamOfUnknownCameraIs404() throws Exception {
        mockMvc.perform(get("/api/cameras/ghost/stream/live.mjpeg"))
                .andExpect(status().isNotFound());
    }

    /** Viewer connection that starts failing writes once the viewer hangs up. */
    static class ViewerStream extends OutputStream {
        private final AtomicInteger written = new AtomicInteger();
        private volatile boolean hungUp;

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (hungUp) {
                throw new IOException("Broken pipe");
            }
            written.addAndGet(len);
        }

        void hangUp() {
            hungUp = true;
        }

        boolean awaitBytes(int count, long timeoutMillis) throws InterruptedException {
            long deadline = System.currentTimeMillis() + timeoutMillis;
            while (written.get() < count) {
                if (System.currentTimeMillis() > deadline) {
                    return false;
                }
                Thread.sleep(10);
            }
            return true;
        }
    }

    private Thread startViewer(String id, ViewerStream viewer) {
        StreamingResponseBody body = new CameraController(supervisor).liveStream(id).getBody();
        Thread thread = new Thread(() -> {
            try {
                body.writeTo(viewer);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, "live-viewer-" + id);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Test
    void liveStreamEndsWhenTheViewerLeavesAnIdleCamera() throws Exception {
        registerPushCamera("door");
        supervisor.ingest("door", jpeg(), 1L);

        ViewerStream viewer = new ViewerStream();
        Thread streaming = startViewer("door", viewer);
        assertTrue(viewer.awaitBytes(64, 5_000));

        // No more frames are pushed from here on
        viewer.hangUp();
        streaming.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(streaming.isAlive());
        assertTrue(supervisor.getWorker("door").orElseThrow().isRunning());
    }

    @Test
    void liveStreamEndsWhenTheViewerLeavesBeforeAnyFrame() throws Exception {
        registerPushCamera("door");

        ViewerStream viewer = new ViewerStream();
        Thread streaming = startViewer("door", viewer);
        assertTrue(viewer.awaitBytes(2, 5_000));

        viewer.hangUp();
        streaming.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(streaming.isAlive());
    }
}
