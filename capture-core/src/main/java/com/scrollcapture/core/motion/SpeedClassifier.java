package com.scrollcapture.core.motion;

/**
 * Pure classifier mapping a smoothed vertical velocity to a {@link ScrollSpeed}.
 *
 * <h3>Bands on {@code |velocity|}</h3>
 * <pre>
 * STATIONARY:  |v| &lt; 0.02
 * TOO_SLOW:    0.02 ≤ |v| &lt; 0.08
 * PERFECT:     0.08 ≤ |v| ≤ 0.30
 * TOO_FAST:    |v| &gt; 0.30
 * </pre>
 *
 * <p>Lower bounds are inclusive, the PERFECT upper bound is inclusive as well. NaN maps to
 * {@link ScrollSpeed#STATIONARY}.
 *
 * <p>Stateless, no side effects. Callers decide the refresh rate; the capture gate calls it
 * once per tick rather than once per sensor sample.
 */
public final class SpeedClassifier {

    public static final double STATIONARY_THRESHOLD = 0.02;
    public static final double SLOW_THRESHOLD       = 0.08;
    public static final double FAST_THRESHOLD       = 0.30;

    private SpeedClassifier() {}

    public static ScrollSpeed classify(double velocity) {
        double abs = Math.abs(velocity);
        if (Double.isNaN(abs) || abs < STATIONARY_THRESHOLD) {
            return ScrollSpeed.STATIONARY;
        }
        if (abs < SLOW_THRESHOLD) {
            return ScrollSpeed.TOO_SLOW;
        }
        if (abs > FAST_THRESHOLD) {
            return ScrollSpeed.TOO_FAST;
        }
        return ScrollSpeed.PERFECT;
    }
}
