package com.trialwatch.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Fixed pause between consecutive calls to the same API.
 */
public class Throttle {

    private static final Logger log = LoggerFactory.getLogger(Throttle.class);

    private final Duration delay;

    public Throttle(Duration delay) {
        this.delay = delay == null ? Duration.ZERO : delay;
    }

    public static Throttle none() {
        return new Throttle(Duration.ZERO);
    }

    public Duration getDelay() {
        return delay;
    }

    public void pause() {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            log.debug("Throttle pause interrupted");
            Thread.currentThread().interrupt();
        }
    }
}
