package com.camingest.camingest.service.source;

import java.io.IOException;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * An open video stream. Read from one thread; {@link #close()} may be called from
 * another thread to unblock a pending read.
 */
public interface FrameSource extends AutoCloseable {

    StreamMetadata getMetadata();

    /**
     * Blocks until the next frame arrives.
     *
     * @return a frame the caller owns, or null at end of stream
     * @throws IOException when the stream broke
     */
    Mat read() throws IOException;

    @Override
    void close();
}
