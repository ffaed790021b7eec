package com.scrollcapture.core.motion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Turns the raw accelerometer stream into a {@link SmoothedMotion} signal.
 *
 * <p>Per sample:
 * <ol>
 *   <li>the vertical value is pushed into a trailing window of {@value #WINDOW_SIZE}
 *       entries, evicting the oldest;</li>
 *   <li>{@code velocity} becomes the arithmetic mean of the window (plain moving average);</li>
 *   <li>{@code stable} is computed from the lateral and depth magnitudes of this sample
 *       only, never from the history.</li>
 * </ol>
 *
 * <p>The sensor callback is the only writer; the capture gate reads {@link #current()} from
 * the tick thread, hence the volatile snapshot. {@link #stop()} disposes the subscription
 * before clearing the window, so a late sample cannot repopulate a reset history.
 */
public class MotionSampler {

    private static final Logger log = LoggerFactory.getLogger(MotionSampler.class);

    public static final int WINDOW_SIZE = 10;

    /** Non-vertical acceleration (g) above which the device counts as shaking or tilting. */
    public static final double STABILITY_THRESHOLD = 0.15;

    /** Smoothed velocity above which the device counts as moving down the receipt. */
    public static final double MOVING_DOWN_THRESHOLD = 0.05;

    private final MotionSensor sensor;

    private final Deque<Double> window = new ArrayDeque<>(WINDOW_SIZE + 1);
    private volatile SmoothedMotion current = SmoothedMotion.initial();
    private Disposable subscription;
    // bumped on every start/stop; samples from an older subscription are dropped
    private volatile long epoch;

    public MotionSampler(MotionSensor sensor) {
        this.sensor = sensor;
    }

    /**
     * Subscribes to the sensor. A running subscription is replaced, never duplicated.
     */
    public synchronized void start() {
        disposeSubscription();
        clearWindow();
        current = SmoothedMotion.initial();
        long subscribedEpoch = ++epoch;
        subscription = sensor.samples().subscribe(
            sample -> {
                if (subscribedEpoch == epoch) {
                    onSample(sample);
                }
            },
            err -> log.warn("[MotionSampler] sensor stream failed. reason={}", err.getMessage())
        );
        log.debug("[MotionSampler] started");
    }

    /**
     * Unsubscribes and clears the window. Safe to call repeatedly and with an empty history.
     */
    public synchronized void stop() {
        epoch++;
        disposeSubscription();
        clearWindow();
        log.debug("[MotionSampler] stopped");
    }

    public synchronized boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    /** Latest published motion snapshot; never null. */
    public SmoothedMotion current() {
        return current;
    }

    /**
     * Folds one sample into the window and publishes the new snapshot.
     */
    public void onSample(MotionSample sample) {
        double velocity;
        int size;
        synchronized (window) {
            window.addLast(sample.verticalAcceleration());
            if (window.size() > WINDOW_SIZE) {
                window.removeFirst();
            }
            double sum = 0.0;
            for (double v : window) {
                sum += v;
            }
            size = window.size();
            velocity = sum / size;
        }

        boolean stable = Math.abs(sample.lateralAcceleration()) < STABILITY_THRESHOLD
            && Math.abs(sample.depthAcceleration()) < STABILITY_THRESHOLD;

        current = new SmoothedMotion(velocity, stable, velocity > MOVING_DOWN_THRESHOLD, size);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private void disposeSubscription() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }

    private void clearWindow() {
        synchronized (window) {
            window.clear();
        }
    }
}
