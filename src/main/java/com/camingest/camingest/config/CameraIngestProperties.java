package com.camingest.camingest.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process-wide settings for camera workers, motion gating and event fan-out.
 * Every camera shares these values.
 */
@Data
@Component
@ConfigurationProperties(prefix = "camera")
public class CameraIngestProperties {

    /** Frames kept per camera. */
    private int bufferCapacity = 10;

    /** Minimum gap between two frame.ingested events of one camera. */
    private Duration frameEventInterval = Duration.ofSeconds(1);

    private Reconnect reconnect = new Reconnect();

    private Source source = new Source();

    private Motion motion = new Motion();

    private Inference inference = new Inference();

    private Snapshots snapshots = new Snapshots();

    private Events events = new Events();

    private Live live = new Live();

    private Discovery discovery = new Discovery();

    private Telegram telegram = new Telegram();

    @Data
    public static class Reconnect {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);

        /** Pause after an unexpected error in a worker's run loop. */
        private Duration errorPause = Duration.ofSeconds(5);

        /** How long stop() waits for the read loop to exit. */
        private Duration stopTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Source {
        /** Socket read timeout handed to FFmpeg, also bounds how long a stalled read blocks stop(). */
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Motion {
        /** Master switch for motion analysis and the inference it triggers. */
        private boolean enabled = true;

        /** Minimum contour area in pixels. */
        private double minArea = 1500;

        private Duration cooldown = Duration.ofSeconds(3);

        /** Only one frame out of every frameSkip is analysed. */
        private int frameSkip = 5;

        private double pixelThreshold = 25;

        private int blurKernel = 21;

        private int dilateIterations = 2;
    }

    @Data
    public static class Inference {
        private Duration triggerCooldown = Duration.ofSeconds(3);
        private Duration personCooldown = Duration.ofSeconds(10);
        private double confidenceThreshold = 0.65;
        private double nmsThreshold = 0.4;
        private String label = "person";

        // Darknet model files; inference stays disabled while any of them is blank
        private String modelConfig = "";
        private String modelWeights = "";
        private String classNames = "";

        public boolean isModelConfigured() {
            return !modelConfig.isBlank() && !modelWeights.isBlank() && !classNames.isBlank();
        }
    }

    @Data
    public static class Snapshots {
        private Path directory = Paths.get(System.getProperty("java.io.tmpdir"), "camera_frames");
    }

    @Data
    public static class Events {
        private int queueCapacity = 1024;
        private Kafka kafka = new Kafka();

        @Data
        public static class Kafka {
            private boolean enabled = false;
            private String topic = "camera-events";
        }
    }

    @Data
    public static class Live {
        private int maxFps = 30;
        // Longest gap between two writes to a live viewer
        private Duration keepAlive = Duration.ofSeconds(1);
    }

    @Data
    public static class Discovery {
        private String urlTemplate = "rtsp://{username}:{password}@{host}:{port}/";
        private int rtspPort = 554;
    }

    @Data
    public static class Telegram {
        private String botToken = "";
        private String chatId = "";
        private String apiBaseUrl = "https://api.telegram.org";

        public boolean isConfigured() {
            return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
        }
    }
}
