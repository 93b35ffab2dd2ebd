package com.camingest.camingest.util;

import java.util.Optional;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imencode;

/**
 * JPEG encode/decode for OpenCV frames.
 */
public final class JpegCodec {

    private JpegCodec() {
        // utility
    }

    /**
     * @return encoded bytes, or empty if the frame is empty or encoding failed
     */
    public static Optional<byte[]> encode(Mat frame) {
        if (frame == null || frame.empty()) {
            return Optional.empty();
        }
        try (BytePointer buf = new BytePointer()) {
            if (!imencode(".jpg", frame, buf)) {
                return Optional.empty();
            }
            byte[] bytes = new byte[(int) buf.limit()];
            buf.get(bytes);
            return Optional.of(bytes);
        }
    }

    /**
     * Decode any image format OpenCV understands into a BGR frame.
     *
     * @return the decoded frame, or empty if the payload is not a readable image
     */
    public static Optional<Mat> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        try (BytePointer data = new BytePointer(payload);
             Mat raw = new Mat(1, payload.length, CV_8UC1, data)) {
            Mat image = imdecode(raw, IMREAD_COLOR);
            if (image == null || image.empty()) {
                return Optional.empty();
            }
            return Optional.of(image);
        }
    }
}
