package com.camingest.camingest.service.buffer;

import org.bytedeco.opencv.opencv_core.Mat;

import com.camingest.camingest.model.entity.SourceKind;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A frame held in a camera's ring buffer. The image belongs to the buffer entry
 * and is never modified after it has been put.
 */
@Getter
@AllArgsConstructor
public class BufferedFrame {

    /** BGR colour image */
    private final Mat image;

    /** epoch millis */
    private final long timestamp;

    private final SourceKind source;
}
