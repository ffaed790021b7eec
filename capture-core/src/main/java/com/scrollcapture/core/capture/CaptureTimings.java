package com.scrollcapture.core.capture;

import java.time.Duration;

/**
 * Timing knobs of the capture loop.
 *
 * @param tickPeriod     how often the gate evaluates stability and refreshes speed guidance
 * @param captureTimeout how long a single photo request may stay in flight
 */
public record CaptureTimings(Duration tickPeriod, Duration captureTimeout) {

    public static final Duration DEFAULT_TICK_PERIOD     = Duration.ofMillis(500);
    public static final Duration DEFAULT_CAPTURE_TIMEOUT = Duration.ofSeconds(3);

    public CaptureTimings {
        if (tickPeriod == null || tickPeriod.isZero() || tickPeriod.isNegative()) {
            throw new IllegalArgumentException("tickPeriod must be positive: " + tickPeriod);
        }
        if (captureTimeout == null || captureTimeout.isZero() || captureTimeout.isNegative()) {
            throw new IllegalArgumentException("captureTimeout must be positive: " + captureTimeout);
        }
    }

    public static CaptureTimings defaults() {
        return new CaptureTimings(DEFAULT_TICK_PERIOD, DEFAULT_CAPTURE_TIMEOUT);
    }
}
