package com.scrollcapture.core.motion;

/**
 * Smoothed motion snapshot published by {@link MotionSampler} after every sample.
 *
 * @param velocity     signed moving average of the vertical axis
 * @param stable       both non-vertical axes of the latest sample are below the shake threshold
 * @param movingDown   {@code velocity} is above the downward-motion threshold
 * @param windowSize   number of samples currently averaged (0 before the first sample)
 */
public record SmoothedMotion(
    double  velocity,
    boolean stable,
    boolean movingDown,
    int     windowSize
) {

    /** State before any sample arrives: motionless and stable. */
    public static SmoothedMotion initial() {
        return new SmoothedMotion(0.0, true, false, 0);
    }
}
