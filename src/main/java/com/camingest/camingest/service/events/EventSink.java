package com.camingest.camingest.service.events;

import com.camingest.camingest.model.dto.CameraEvent;

/**
 * A downstream consumer of camera events (dashboard socket, Kafka, chat notifier).
 * Failures are isolated per sink and per event by the publisher.
 */
public interface EventSink {

    String getName();

    void deliver(String channel, CameraEvent event) throws Exception;
}
