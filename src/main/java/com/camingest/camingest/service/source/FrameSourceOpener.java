package com.camingest.camingest.service.source;

import java.io.IOException;

/**
 * Stream-open capability: given a URL, open a frame source.
 */
@FunctionalInterface
public interface FrameSourceOpener {

    /**
     * @throws IOException if the stream cannot be opened
     */
    FrameSource open(String url) throws IOException;
}
