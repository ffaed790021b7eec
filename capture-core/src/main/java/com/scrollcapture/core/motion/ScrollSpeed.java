package com.scrollcapture.core.motion;

/**
 * User-facing scroll speed guidance derived from the smoothed vertical velocity.
 *
 * <ul>
 *   <li>{@link #STATIONARY}: device not moving along the receipt</li>
 *   <li>{@link #TOO_SLOW}  : moving, but slowly enough to waste frames</li>
 *   <li>{@link #PERFECT}   : the band in which a fixed overlap ratio holds up</li>
 *   <li>{@link #TOO_FAST}  : consecutive frames will stop overlapping</li>
 * </ul>
 */
public enum ScrollSpeed {

    STATIONARY("Start moving down"),
    TOO_SLOW("Move a bit faster"),
    PERFECT("Perfect speed"),
    TOO_FAST("Slow down");

    private final String guidance;

    ScrollSpeed(String guidance) {
        this.guidance = guidance;
    }

    public String guidance() {
        return guidance;
    }
}
