package com.camingest.camingest.service.motion;

import java.time.Clock;
import java.time.Duration;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_core.absdiff;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Frame-difference motion detection using JavaCV (OpenCV wrapper).
 *
 * Every call compares the current frame with the frame of the previous call:
 * luminance, Gaussian blur, absolute difference, binary threshold, dilation,
 * then external contours. Motion is reported when any contour is larger than
 * the configured minimum area. After a positive report the detector stays
 * quiet until its cooldown has elapsed, but keeps refreshing its reference frame.
 *
 * Not thread-safe: one instance per camera, driven by that camera's frame processor.
 *
 * Usage:
 * MotionDetector detector = new MotionDetector(settings, clock);
 * if (detector.detect(mat)) {
 *     // run inference, publish motion.detected, ...
 * }
 */
public class MotionDetector {

    private final double minArea;
    private final double pixelThreshold;
    private final int blurKernel;
    private final int dilateIterations;
    private final long cooldownMillis;
    private final Clock clock;

    // Owned exclusively by this detector; replaced on every call
    private Mat reference;
    private long cooldownUntil = Long.MIN_VALUE;

    public MotionDetector(double minArea, double pixelThreshold, int blurKernel,
                          int dilateIterations, Duration cooldown, Clock clock) {
        if (blurKernel <= 0 || blurKernel % 2 == 0) {
            throw new IllegalArgumentException("blur kernel must be a positive odd number: " + blurKernel);
        }
        this.minArea = minArea;
        this.pixelThreshold = pixelThreshold;
        this.blurKernel = blurKernel;
        this.dilateIterations = dilateIterations;
        this.cooldownMillis = cooldown.toMillis();
        this.clock = clock;
    }

    /**
     * @param frame BGR or single-channel frame; never modified
     * @return true if significant motion was detected against the previous call's frame
     */
    public boolean detect(Mat frame) {
        if (frame == null || frame.empty()) {
            return false;
        }

        Mat current = toBlurredGray(frame);

        // Cold start, or the stream changed resolution under us
        if (reference == null || reference.rows() != current.rows() || reference.cols() != current.cols()) {
            replaceReference(current);
            return false;
        }

        long now = clock.millis();
        if (now < cooldownUntil) {
            replaceReference(current);
            return false;
        }

        boolean motion = hasLargeChangedRegion(reference, current);
        if (motion) {
            cooldownUntil = now + cooldownMillis;
        }
        replaceReference(current);
        return motion;
    }

    public boolean isCoolingDown() {
        return clock.millis() < cooldownUntil;
    }

    /**
     * Drop the reference frame, e.g. after a reconnect when the scene may have changed.
     */
    public void reset() {
        if (reference != null) {
            reference.close();
            reference = null;
        }
    }

    private boolean hasLargeChangedRegion(Mat previous, Mat current) {
        try (Mat delta = new Mat();
             Mat mask = new Mat();
             Mat defaultKernel = new Mat();
             MatVector contours = new MatVector()) {

            absdiff(previous, current, delta);
            threshold(delta, mask, pixelThreshold, 255, THRESH_BINARY);

            // Merge nearby fragments into one region
            dilate(mask, mask, defaultKernel, new Point(-1, -1), dilateIterations,
                    BORDER_CONSTANT, morphologyDefaultBorderValue());

            findContours(mask, contours, RETR_EXTERNAL, CHAIN_APPROX_SIMPLE);
            for (long i = 0; i < contours.size(); i++) {
                if (contourArea(contours.get(i)) > minArea) {
                    return true;
                }
            }
            return false;
        }
    }

    private Mat toBlurredGray(Mat frame) {
        Mat gray = new Mat();
        if (frame.channels() == 1) {
            frame.copyTo(gray);
        } else {
            cvtColor(frame, gray, frame.channels() == 4 ? COLOR_BGRA2GRAY : COLOR_BGR2GRAY);
        }
        // Suppress sensor noise
        GaussianBlur(gray, gray, new Size(blurKernel, blurKernel), 0);
        return gray;
    }

    private void replaceReference(Mat current) {
        if (reference != null) {
            reference.close();
        }
        reference = current;
    }
}
