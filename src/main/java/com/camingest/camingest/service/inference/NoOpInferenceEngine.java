package com.camingest.camingest.service.inference;

import java.util.Collections;
import java.util.List;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Used when no model files are configured: motion is still detected and published,
 * but never escalates to a person alert.
 */
public class NoOpInferenceEngine implements InferenceEngine {

    @Override
    public List<Detection> infer(Mat frame) {
        return Collections.emptyList();
    }
}
