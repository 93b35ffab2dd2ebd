package com.camingest.camingest.service.inference;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_core.StringVector;
import org.bytedeco.opencv.opencv_dnn.Net;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_dnn.*;

/**
 * YOLO (Darknet cfg + weights) through the OpenCV DNN module on CPU.
 * Returns only detections of the configured label above the confidence threshold,
 * after non-maximum suppression.
 */
public class DarknetInferenceEngine implements InferenceEngine {

    private static final Logger logger = LoggerFactory.getLogger(DarknetInferenceEngine.class);

    private static final int INPUT_SIZE = 416;

    private final Net net;
    private final StringVector outputLayers;
    private final List<String> classNames;
    private final int targetClassId;
    private final float confidenceThreshold;
    private final float nmsThreshold;

    public DarknetInferenceEngine(String configPath, String weightsPath, String namesPath,
                                  String targetLabel, double confidenceThreshold, double nmsThreshold) throws IOException {
        this.classNames = Files.readAllLines(Paths.get(namesPath), StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        this.targetClassId = classNames.indexOf(targetLabel);
        if (targetClassId < 0) {
            throw new IOException("Label '" + targetLabel + "' not found in " + namesPath);
        }
        requireFile(configPath);
        requireFile(weightsPath);

        this.net = readNetFromDarknet(configPath, weightsPath);
        net.setPreferableBackend(DNN_BACKEND_OPENCV);
        net.setPreferableTarget(DNN_TARGET_CPU);
        this.outputLayers = net.getUnconnectedOutLayersNames();
        this.confidenceThreshold = (float) confidenceThreshold;
        this.nmsThreshold = (float) nmsThreshold;

        logger.info("Darknet detector loaded: cfg={}, classes={}, target='{}'", configPath, classNames.size(), targetLabel);
    }

    // Net is not thread-safe; cameras share one engine
    @Override
    public synchronized List<Detection> infer(Mat frame) {
        int frameW = frame.cols();
        int frameH = frame.rows();

        List<float[]> candidates = new ArrayList<>();
        try (Mat blob = blobFromImage(frame, 1 / 255.0, new Size(INPUT_SIZE, INPUT_SIZE),
                new Scalar(0, 0, 0, 0), true, false, CV_32F);
             MatVector outputs = new MatVector()) {

            net.setInput(blob);
            net.forward(outputs, outputLayers);

            for (long o = 0; o < outputs.size(); o++) {
                Mat out = outputs.get(o);
                try (FloatIndexer idx = out.createIndexer()) {
                    int cols = out.cols();
                    for (int r = 0; r < out.rows(); r++) {
                        // [cx, cy, w, h, objectness, class scores...]
                        int best = -1;
                        float bestScore = 0f;
                        for (int c = 5; c < cols; c++) {
                            float score = idx.get(r, c);
                            if (score > bestScore) {
                                bestScore = score;
                                best = c - 5;
                            }
                        }
                        if (best != targetClassId || bestScore <= confidenceThreshold) {
                            continue;
                        }
                        float w = idx.get(r, 2) * frameW;
                        float h = idx.get(r, 3) * frameH;
                        float x1 = idx.get(r, 0) * frameW - w / 2;
                        float y1 = idx.get(r, 1) * frameH - h / 2;
                        candidates.add(new float[]{x1, y1, x1 + w, y1 + h, bestScore});
                    }
                }
            }
        }

        return nms(candidates);
    }

    private List<Detection> nms(List<float[]> boxes) {
        List<Detection> results = new ArrayList<>();
        boxes.sort((a, b) -> Float.compare(b[4], a[4]));
        boolean[] suppressed = new boolean[boxes.size()];

        for (int i = 0; i < boxes.size(); i++) {
            if (suppressed[i]) continue;
            float[] best = boxes.get(i);
            results.add(new Detection(classNames.get(targetClassId), best[4],
                    Math.round(best[0]), Math.round(best[1]),
                    Math.round(best[2] - best[0]), Math.round(best[3] - best[1])));

            for (int j = i + 1; j < boxes.size(); j++) {
                if (!suppressed[j] && iou(best, boxes.get(j)) > nmsThreshold) {
                    suppressed[j] = true;
                }
            }
        }
        return results;
    }

    private static float iou(float[] a, float[] b) {
        float ix1 = Math.max(a[0], b[0]);
        float iy1 = Math.max(a[1], b[1]);
        float ix2 = Math.min(a[2], b[2]);
        float iy2 = Math.min(a[3], b[3]);
        float inter = Math.max(0, ix2 - ix1) * Math.max(0, iy2 - iy1);
        float union = (a[2] - a[0]) * (a[3] - a[1]) + (b[2] - b[0]) * (b[3] - b[1]) - inter;
        return union <= 0 ? 0 : inter / union;
    }

    private static void requireFile(String path) throws IOException {
        Path p = Paths.get(path);
        if (!Files.isRegularFile(p)) {
            throw new IOException("Model file not found: " + p.toAbsolutePath());
        }
    }
}
