package com.camingest.camingest.service.worker;

import java.time.Duration;

/**
 * Per-camera gating state for frame processing: the frame.ingested throttle,
 * the frame-skip counter, the inference trigger cooldown and the person alert cooldown.
 * All times are epoch millis supplied by the caller.
 *
 * Confined to the camera's frame processor (callers hold its processing lock).
 */
public class FrameGateState {

    private final int frameSkip;
    private final long frameEventIntervalMillis;
    private final long triggerCooldownMillis;
    private final long personCooldownMillis;

    private boolean frameEventPublished = false;
    private long lastFrameEventAt;
    private long frameCounter = 0;
    private long inferenceCooldownUntil = Long.MIN_VALUE;
    private long personCooldownUntil = Long.MIN_VALUE;

    public FrameGateState(int frameSkip, Duration frameEventInterval,
                          Duration triggerCooldown, Duration personCooldown) {
        if (frameSkip < 1) {
            throw new IllegalArgumentException("frame skip must be at least 1: " + frameSkip);
        }
        this.frameSkip = frameSkip;
        this.frameEventIntervalMillis = frameEventInterval.toMillis();
        this.triggerCooldownMillis = triggerCooldown.toMillis();
        this.personCooldownMillis = personCooldown.toMillis();
    }

    /**
     * True for the first frame and whenever more than the interval has passed since
     * the last publication; records the publication when it returns true.
     */
    public boolean tryAcquireFrameEvent(long now) {
        if (frameEventPublished && now - lastFrameEventAt <= frameEventIntervalMillis) {
            return false;
        }
        frameEventPublished = true;
        lastFrameEventAt = now;
        return true;
    }

    /**
     * Advances the frame-skip counter. True for the first frame of every window of
     * {@code frameSkip} frames, and only while the inference cooldown is not active.
     */
    public boolean shouldCheckMotion(long now) {
        boolean sampled = frameCounter++ % frameSkip == 0;
        return sampled && now >= inferenceCooldownUntil;
    }

    public void startInferenceCooldown(long now) {
        inferenceCooldownUntil = now + triggerCooldownMillis;
    }

    public boolean isPersonCooldownActive(long now) {
        return now < personCooldownUntil;
    }

    public void startPersonCooldown(long now) {
        personCooldownUntil = now + personCooldownMillis;
    }

    public long getFrameCounter() {
        return frameCounter;
    }

    public long getInferenceCooldownUntil() {
        return inferenceCooldownUntil;
    }

    public long getPersonCooldownUntil() {
        return personCooldownUntil;
    }
}
