package com.scrollcapture.service.device;

import com.scrollcapture.core.motion.MotionSample;
import com.scrollcapture.core.motion.MotionSensor;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;

/**
 * Simulated accelerometer emitting a steady motion profile every {@link #SAMPLE_PERIOD}.
 *
 * <p>The profile can be changed at runtime with {@link #update}; samples emitted after the
 * call carry the new values.
 */
public class ScriptedMotionSensor implements MotionSensor {

    private final Scheduler scheduler;

    private volatile double vertical;
    private volatile double lateral;
    private volatile double depth;

    public ScriptedMotionSensor(double vertical, double lateral, double depth, Scheduler scheduler) {
        this.vertical  = vertical;
        this.lateral   = lateral;
        this.depth     = depth;
        this.scheduler = scheduler;
    }

    @Override
    public Flux<MotionSample> samples() {
        return Flux.interval(SAMPLE_PERIOD, scheduler)
            .map(t -> new MotionSample(vertical, lateral, depth, Instant.now()));
    }

    public void update(double vertical, double lateral, double depth) {
        this.vertical = vertical;
        this.lateral  = lateral;
        this.depth    = depth;
    }

    public double getVertical() { return vertical; }
    public double getLateral()  { return lateral; }
    public double getDepth()    { return depth; }
}
