package com.scrollcapture.core.motion;

import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Boundary to the device accelerometer.
 *
 * <p>Implementations emit {@link MotionSample}s at a fixed rate once subscribed. Cancelling
 * the subscription must stop delivery immediately; {@link MotionSampler#stop()} relies on it
 * to guarantee no sample lands after a session reset.
 */
public interface MotionSensor {

    /** Nominal accelerometer period (20 Hz). */
    Duration SAMPLE_PERIOD = Duration.ofMillis(50);

    Flux<MotionSample> samples();
}
