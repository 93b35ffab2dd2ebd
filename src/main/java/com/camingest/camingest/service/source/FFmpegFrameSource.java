package com.camingest.camingest.service.source;

import java.io.IOException;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.OpenCVFrameConverter;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A started FFmpegFrameGrabber, handing out BGR frames as cloned Mats.
 */
class FFmpegFrameSource implements FrameSource {

    private static final Logger logger = LoggerFactory.getLogger(FFmpegFrameSource.class);

    private final FFmpegFrameGrabber grabber;
    private final OpenCVFrameConverter.ToMat converter = new OpenCVFrameConverter.ToMat();
    private final StreamMetadata metadata;
    private volatile boolean closed = false;

    FFmpegFrameSource(FFmpegFrameGrabber grabber) {
        this.grabber = grabber;
        this.metadata = new StreamMetadata(
                grabber.getImageWidth() > 0 ? grabber.getImageWidth() : null,
                grabber.getImageHeight() > 0 ? grabber.getImageHeight() : null,
                grabber.getFrameRate() > 0 ? grabber.getFrameRate() : null);
    }

    @Override
    public StreamMetadata getMetadata() {
        return metadata;
    }

    @Override
    public Mat read() throws IOException {
        if (closed) {
            throw new IOException("Source closed");
        }
        Frame frame = grabber.grabImage();
        if (frame == null) {
            return null;
        }
        if (frame.image == null || frame.imageWidth <= 0 || frame.imageHeight <= 0) {
            throw new IOException("Invalid frame from grabber");
        }
        // The converter and grabber reuse their buffers; the caller gets its own copy
        Mat view = converter.convert(frame);
        if (view == null || view.empty()) {
            throw new IOException("Frame conversion failed");
        }
        return view.clone();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        releaseQuietly(grabber);
    }

    /**
     * Stop and release, each step logged but never thrown.
     */
    static void releaseQuietly(FFmpegFrameGrabber grabber) {
        try {
            grabber.stop();
            logger.debug("Grabber stopped successfully");
        } catch (Exception e) {
            logger.warn("Error stopping grabber: {}", e.getMessage());
        }

        try {
            grabber.release();
            logger.debug("Grabber released successfully");
        } catch (Exception e) {
            logger.error("Error releasing grabber: {}", e.getMessage(), e);
        }
    }
}
