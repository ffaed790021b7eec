package com.scrollcapture.core.camera;

import com.scrollcapture.core.capture.CaptureTimings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link CameraCollaborator} over a {@link PhotoSource} that enforces one outstanding capture.
 *
 * <p>The in-flight flag is claimed with compare-and-set when the returned {@link Mono} is
 * subscribed and released in {@code doFinally}, so it is cleared on success, empty completion,
 * device error, timeout and cancellation alike. The tick thread and the device completion
 * thread never race on it.
 *
 * <p>Each request is its own single-slot promise: there is no table of pending completions
 * to match results against, because the slot guarantees there is only ever one.
 *
 * <p>A device that never answers is cut off after {@code captureTimeout}; the frame is
 * dropped and logged so the gate keeps ticking.
 */
public class SingleSlotCamera implements CameraCollaborator {

    private static final Logger log = LoggerFactory.getLogger(SingleSlotCamera.class);

    private final PhotoSource photoSource;
    private final Duration    captureTimeout;
    private final Scheduler   timeoutScheduler;

    private final AtomicBoolean inFlight     = new AtomicBoolean(false);
    private final AtomicLong    requestCount = new AtomicLong();

    public SingleSlotCamera(PhotoSource photoSource) {
        this(photoSource, CaptureTimings.DEFAULT_CAPTURE_TIMEOUT, Schedulers.parallel());
    }

    public SingleSlotCamera(PhotoSource photoSource, Duration captureTimeout, Scheduler timeoutScheduler) {
        this.photoSource      = photoSource;
        this.captureTimeout   = captureTimeout;
        this.timeoutScheduler = timeoutScheduler;
    }

    @Override
    public boolean isInFlight() {
        return inFlight.get();
    }

    @Override
    public Mono<BufferedImage> requestCapture(FlashMode flashMode) {
        return Mono.defer(() -> {
            if (!inFlight.compareAndSet(false, true)) {
                log.debug("[Camera] capture refused, request already in flight");
                return Mono.empty();
            }
            long requestId = requestCount.incrementAndGet();
            log.debug("[Camera] capture issued. requestId={} flash={}", requestId, flashMode);

            return Mono.defer(() -> photoSource.capture(flashMode))
                .timeout(captureTimeout, timeoutScheduler)
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("[Camera] capture timed out, clearing in-flight. requestId={} timeoutMs={}",
                             requestId, captureTimeout.toMillis());
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.warn("[Camera] capture failed, frame skipped. requestId={} reason={}",
                             requestId, e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> inFlight.set(false));
        });
    }

    /** Total captures handed to the device since construction. */
    public long getRequestCount() {
        return requestCount.get();
    }
}
