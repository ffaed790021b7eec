package com.scrollcapture.core.motion;

import java.time.Instant;

/**
 * One raw accelerometer reading in device portrait frame.
 *
 * <p>{@code verticalAcceleration} is the y-axis (down the receipt), {@code lateralAcceleration}
 * the x-axis and {@code depthAcceleration} the z-axis, all in g.
 */
public record MotionSample(
    double  verticalAcceleration,
    double  lateralAcceleration,
    double  depthAcceleration,
    Instant timestamp
) {}
