package com.scrollcapture.core.capture;

import com.scrollcapture.core.camera.CameraCollaborator;
import com.scrollcapture.core.motion.MotionSampler;
import com.scrollcapture.core.motion.ScrollSpeed;
import com.scrollcapture.core.motion.SmoothedMotion;
import com.scrollcapture.core.motion.SpeedClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic capture trigger with backpressure against a single-slot camera.
 *
 * <p>Every tick:
 * <ol>
 *   <li>refresh the user-facing {@link ScrollSpeed} from the latest smoothed velocity;</li>
 *   <li>read {@code stable} from the {@link MotionSampler} and {@code inFlight} from the camera;</li>
 *   <li>if {@code stable && !inFlight}, issue exactly one capture request, otherwise do nothing.</li>
 * </ol>
 *
 * <p>Speed guidance is refreshed on every tick regardless of the gating decision, which keeps
 * UI updates at the tick rate instead of the 20 Hz sensor rate.
 *
 * <p>Ticks run on the injected {@link Scheduler}; tests drive it with a virtual clock.
 * {@link #start()} on a running gate replaces the tick subscription, so there is never more
 * than one.
 */
public class CaptureGate {

    private static final Logger log = LoggerFactory.getLogger(CaptureGate.class);

    private final MotionSampler      sampler;
    private final CameraCollaborator camera;
    private final Runnable           captureRequest;
    private final Duration           tickPeriod;
    private final Scheduler          scheduler;

    private volatile CaptureFeedbackListener listener = CaptureFeedbackListener.NO_OP;
    private volatile ScrollSpeed             speed    = ScrollSpeed.PERFECT;

    private final AtomicLong tickCount   = new AtomicLong();
    private final AtomicLong issuedCount = new AtomicLong();

    private Disposable ticker;

    public CaptureGate(MotionSampler sampler,
                       CameraCollaborator camera,
                       Runnable captureRequest,
                       Duration tickPeriod,
                       Scheduler scheduler) {
        this.sampler        = sampler;
        this.camera         = camera;
        this.captureRequest = captureRequest;
        this.tickPeriod     = tickPeriod;
        this.scheduler      = scheduler;
    }

    public void setListener(CaptureFeedbackListener listener) {
        this.listener = listener != null ? listener : CaptureFeedbackListener.NO_OP;
    }

    public synchronized void start() {
        disposeTicker();
        tickCount.set(0);
        issuedCount.set(0);
        speed = ScrollSpeed.PERFECT;
        ticker = Flux.interval(tickPeriod, tickPeriod, scheduler)
            .subscribe(
                t -> tick(),
                err -> log.error("[CaptureGate] tick stream terminated unexpectedly", err)
            );
        log.debug("[CaptureGate] started. periodMs={}", tickPeriod.toMillis());
    }

    /** Cancels the tick synchronously; no tick starts after this returns. */
    public synchronized void stop() {
        disposeTicker();
        log.debug("[CaptureGate] stopped. ticks={} issued={}", tickCount.get(), issuedCount.get());
    }

    public synchronized boolean isRunning() {
        return ticker != null && !ticker.isDisposed();
    }

    /**
     * Runs one gate evaluation. Called by the periodic tick; public so callers can force an
     * evaluation outside the schedule.
     */
    public GateDecision tick() {
        tickCount.incrementAndGet();
        SmoothedMotion motion = sampler.current();

        ScrollSpeed latest = SpeedClassifier.classify(motion.velocity());
        speed = latest;
        listener.onSpeedChanged(latest);

        if (!motion.stable()) {
            log.trace("[CaptureGate] tick skipped. stable=false velocity={}", motion.velocity());
            return GateDecision.SKIPPED_UNSTABLE;
        }
        if (camera.isInFlight()) {
            log.trace("[CaptureGate] tick skipped. inFlight=true");
            return GateDecision.SKIPPED_IN_FLIGHT;
        }

        issuedCount.incrementAndGet();
        try {
            captureRequest.run();
        } catch (RuntimeException e) {
            log.warn("[CaptureGate] capture request failed. reason={}", e.getMessage());
        }
        return GateDecision.CAPTURE_ISSUED;
    }

    public ScrollSpeed currentSpeed() {
        return speed;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    /** Capture requests issued by ticks since the last {@link #start()}. */
    public long getIssuedCount() {
        return issuedCount.get();
    }

    private void disposeTicker() {
        if (ticker != null) {
            ticker.dispose();
            ticker = null;
        }
    }
}
