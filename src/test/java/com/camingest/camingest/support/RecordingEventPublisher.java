package com.camingest.camingest.support;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.model.dto.CameraEventType;
import com.camingest.camingest.service.events.EventPublisher;

public class RecordingEventPublisher implements EventPublisher {

    private final List<CameraEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean failing = false;

    @Override
    public void publish(String channel, CameraEvent event) {
        if (failing) {
            throw new IllegalStateException("publisher down");
        }
        events.add(event);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<CameraEvent> all() {
        return List.copyOf(events);
    }

    public List<CameraEvent> ofType(CameraEventType type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }

    public Optional<CameraEvent> await(CameraEventType type, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            List<CameraEvent> found = ofType(type);
            if (!found.isEmpty()) {
                return Optional.of(found.get(0));
            }
            Thread.sleep(5);
        }
        return Optional.empty();
    }

    public void clear() {
        events.clear();
    }
}
