package com.camingest.camingest.service.inference;

import java.util.List;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Deep-inference capability: frame in, detections out.
 * Implementations may be slow; callers invoke them on a copy of the frame.
 */
public interface InferenceEngine {

    /**
     * @param frame BGR colour frame owned by the caller
     * @return zero or more detections, never null
     * @throws Exception on any model failure; callers treat it as "no detection"
     */
    List<Detection> infer(Mat frame) throws Exception;
}
