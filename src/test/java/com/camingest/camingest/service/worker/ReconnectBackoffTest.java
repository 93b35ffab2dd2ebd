package com.camingest.camingest.service.worker;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class ReconnectBackoffTest {

    @Test
    void doublesUpToTheCapAndResets() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60));
        assertEquals(Duration.ofSeconds(1), backoff.getCurrentDelay());

        long[] expected = {2, 4, 8, 16, 32, 60, 60};
        for (long seconds : expected) {
            assertEquals(Duration.ofSeconds(seconds), backoff.increase());
        }

        backoff.reset();
        assertEquals(Duration.ofSeconds(1), backoff.getCurrentDelay());
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectBackoff(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectBackoff(Duration.ofSeconds(10), Duration.ofSeconds(1)));
    }
}
