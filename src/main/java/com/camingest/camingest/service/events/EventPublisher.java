package com.camingest.camingest.service.events;

import com.camingest.camingest.model.dto.CameraEvent;

/**
 * Fire-and-forget event emission. Implementations must never block the caller
 * for long and must never throw: workers call this from their read loop.
 */
public interface EventPublisher {

    void publish(String channel, CameraEvent event);

    default void publish(CameraEvent event) {
        publish(event.getChannel(), event);
    }
}
