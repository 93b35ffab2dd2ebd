package com.camingest.camingest.service.source;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What the source reported on open. Any field may be null when the container does not say.
 */
@Getter
@ToString
@AllArgsConstructor
public class StreamMetadata {
    private final Integer width;
    private final Integer height;
    private final Double fps;

    public static StreamMetadata unknown() {
        return new StreamMetadata(null, null, null);
    }
}
