package com.camingest.camingest.service.events;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.service.metrics.CameraMetrics;

/**
 * Bounded, best-effort event fan-out.
 *
 * publish() only offers to a fixed-size queue and returns; when the queue is full the
 * event is dropped and counted. A single dispatcher thread delivers each event to every
 * sink in order; a failing sink is logged and skipped, the others still receive the event.
 */
public class AsyncEventPublisher implements EventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(AsyncEventPublisher.class);

    private static final long POLL_MILLIS = 200;
    private static final long DROP_LOG_EVERY = 100;

    private final BlockingQueue<Envelope> queue;
    private final List<EventSink> sinks;
    private final CameraMetrics metrics;
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean running = false;
    private Thread dispatcher;

    public AsyncEventPublisher(int queueCapacity, List<EventSink> sinks, CameraMetrics metrics) {
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.sinks = new CopyOnWriteArrayList<>(sinks);
        this.metrics = metrics;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "camera-event-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        logger.info("Event publisher started with {} sink(s): {}", sinks.size(),
                sinks.stream().map(EventSink::getName).toList());
    }

    /**
     * Stops accepting events, delivers what is already queued, then stops the dispatcher.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            dispatcher.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!queue.isEmpty()) {
            logger.warn("Event publisher stopped with {} undelivered event(s)", queue.size());
            queue.clear();
        }
        logger.info("Event publisher stopped (dropped {} event(s) in total)", dropped.get());
    }

    @Override
    public void publish(String channel, CameraEvent event) {
        if (event == null) {
            return;
        }
        if (!running || !queue.offer(new Envelope(channel, event))) {
            long n = dropped.incrementAndGet();
            metrics.incrementEventsDropped();
            if (n % DROP_LOG_EVERY == 1) {
                logger.warn("Event dropped ({} so far): {} on {}", n, event.getType().getWireName(), channel);
            }
        }
    }

    public void addSink(EventSink sink) {
        sinks.add(sink);
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getQueuedCount() {
        return queue.size();
    }

    public boolean isRunning() {
        return running;
    }

    private void dispatchLoop() {
        while (running || !queue.isEmpty()) {
            Envelope envelope;
            try {
                envelope = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (envelope != null) {
                deliver(envelope);
            }
        }
    }

    private void deliver(Envelope envelope) {
        for (EventSink sink : sinks) {
            try {
                sink.deliver(envelope.channel, envelope.event);
            } catch (Exception e) {
                metrics.incrementSinkFailures(sink.getName());
                logger.warn("Sink '{}' failed on {}: {}", sink.getName(), envelope.event, e.getMessage());
            }
        }
    }

    private static final class Envelope {
        final String channel;
        final CameraEvent event;

        Envelope(String channel, CameraEvent event) {
            this.channel = channel;
            this.event = event;
        }
    }
}
