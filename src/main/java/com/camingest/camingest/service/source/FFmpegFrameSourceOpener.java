package com.camingest.camingest.service.source;

import java.io.IOException;
import java.time.Duration;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FrameGrabber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens RTSP and MJPEG/HTTP streams with FFmpegFrameGrabber.
 */
public class FFmpegFrameSourceOpener implements FrameSourceOpener {

    private static final Logger logger = LoggerFactory.getLogger(FFmpegFrameSourceOpener.class);

    private final Duration readTimeout;

    public FFmpegFrameSourceOpener(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    @Override
    public FrameSource open(String url) throws IOException {
        FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(url);
        try {
            configureGrabber(grabber, url);
            grabber.start();
        } catch (IOException | RuntimeException e) {
            FFmpegFrameSource.releaseQuietly(grabber);
            throw e instanceof IOException ? (IOException) e
                    : new IOException("Failed to open stream: " + e.getMessage(), e);
        }

        FFmpegFrameSource source = new FFmpegFrameSource(grabber);
        logger.debug("Opened {} ({})", redact(url), source.getMetadata());
        return source;
    }

    /**
     * Low-latency decode options; RTSP additionally forced onto TCP.
     */
    void configureGrabber(FFmpegFrameGrabber grabber, String url) {
        grabber.setImageMode(FrameGrabber.ImageMode.COLOR);

        String micros = String.valueOf(readTimeout.toMillis() * 1000);

        // Thread configuration
        grabber.setOption("threads", "1");

        // Connection and timeout settings
        grabber.setOption("analyzeduration", "5000000");
        grabber.setOption("probesize", "5000000");
        grabber.setOption("rw_timeout", micros);
        grabber.setOption("timeout", micros);

        // Error handling
        grabber.setOption("err_detect", "ignore_err");
        grabber.setOption("fflags", "+discardcorrupt+nobuffer+genpts");
        grabber.setOption("flags", "low_delay");

        if (url.regionMatches(true, 0, "rtsp", 0, 4)) {
            grabber.setFormat("rtsp");
            grabber.setOption("rtsp_transport", "tcp");
            grabber.setOption("rtsp_flags", "prefer_tcp");
            grabber.setOption("stimeout", micros);
            grabber.setOption("buffer_size", "8192000");
            grabber.setOption("allowed_media_types", "video");
            grabber.setOption("max_delay", "1000000");
        } else {
            grabber.setOption("reconnect", "0");
        }
    }

    // Keep credentials out of logs
    public static String redact(String url) {
        return url.replaceAll("://[^/@]+@", "://***@");
    }
}
