package com.camingest.camingest.service.inference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.camingest.camingest.util.JpegCodec;

import static org.bytedeco.opencv.global.opencv_imgproc.FONT_HERSHEY_SIMPLEX;
import static org.bytedeco.opencv.global.opencv_imgproc.LINE_8;
import static org.bytedeco.opencv.global.opencv_imgproc.putText;
import static org.bytedeco.opencv.global.opencv_imgproc.rectangle;

/**
 * Keeps the single frame that triggered a detection alert, annotated with its boxes.
 * Files land under {@code <directory>/<cameraId>/}; consumers of person.detected
 * events read (and may delete) them.
 */
public class SnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

    private final Path directory;

    public SnapshotStore(Path directory) {
        this.directory = directory;
    }

    /**
     * Draws the detections onto {@code frame} (which must be a private copy) and writes it as JPEG.
     *
     * @return path of the written file
     */
    public Path saveAlertFrame(String cameraId, Mat frame, List<Detection> detections) throws IOException {
        annotate(frame, detections);

        byte[] jpeg = JpegCodec.encode(frame)
                .orElseThrow(() -> new IOException("JPEG encoding failed for camera " + cameraId));

        Path cameraDir = directory.resolve(sanitize(cameraId));
        Files.createDirectories(cameraDir);
        Path file = cameraDir.resolve(System.currentTimeMillis() + "-" + UUID.randomUUID() + ".jpg");
        Files.write(file, jpeg);

        logger.debug("Alert frame saved: {} ({} bytes)", file, jpeg.length);
        return file;
    }

    public Path getDirectory() {
        return directory;
    }

    static void annotate(Mat frame, List<Detection> detections) {
        Scalar green = new Scalar(0, 255, 0, 0);
        for (Detection d : detections) {
            if (!d.hasBox()) {
                continue;
            }
            rectangle(frame, new Point(d.getX(), d.getY()),
                    new Point(d.getX() + d.getWidth(), d.getY() + d.getHeight()), green, 2, LINE_8, 0);
            String text = String.format(Locale.ROOT, "%s: %.2f", d.getLabel(), d.getConfidence());
            putText(frame, text, new Point(d.getX(), Math.max(0, d.getY() - 5)),
                    FONT_HERSHEY_SIMPLEX, 0.5, green, 2, LINE_8, false);
        }
    }

    // Camera ids end up in file names
    private static String sanitize(String cameraId) {
        return cameraId.replaceAll("[^a-zA-Z0-9_-]", "_");
    }
}
