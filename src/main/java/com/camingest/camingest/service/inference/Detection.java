package com.camingest.camingest.service.inference;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class Detection {
    private final String label;
    private final float confidence;
    // Box in frame pixels, top-left corner + size
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public Detection(String label, float confidence) {
        this(label, confidence, 0, 0, 0, 0);
    }

    public boolean hasBox() {
        return width > 0 && height > 0;
    }
}
