package com.camingest.camingest.service.worker;

import java.time.Duration;

/**
 * Exponential reconnect delay: starts at the initial value, doubles after every
 * failed attempt up to the cap, back to the initial value on a successful connect.
 * Confined to the worker's read-loop thread; readers only look at the volatile value.
 */
public class ReconnectBackoff {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private volatile Duration currentDelay;

    public ReconnectBackoff(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initial delay must be positive: " + initialDelay);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("max delay " + maxDelay + " is below initial delay " + initialDelay);
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.currentDelay = initialDelay;
    }

    public Duration getCurrentDelay() {
        return currentDelay;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * Double the delay, capped.
     */
    public Duration increase() {
        Duration doubled = currentDelay.multipliedBy(2);
        currentDelay = doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
        return currentDelay;
    }

    public void reset() {
        currentDelay = initialDelay;
    }
}
