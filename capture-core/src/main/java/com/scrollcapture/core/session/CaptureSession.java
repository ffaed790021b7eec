package com.scrollcapture.core.session;

import com.scrollcapture.core.camera.CameraCollaborator;
import com.scrollcapture.core.camera.FlashMode;
import com.scrollcapture.core.capture.CaptureFeedbackListener;
import com.scrollcapture.core.capture.CaptureGate;
import com.scrollcapture.core.capture.CaptureTimings;
import com.scrollcapture.core.capture.CapturedFrame;
import com.scrollcapture.core.capture.FrameBuffer;
import com.scrollcapture.core.exception.FrameRejectedException;
import com.scrollcapture.core.exception.StitchException;
import com.scrollcapture.core.handoff.AcceptedReceipt;
import com.scrollcapture.core.handoff.ReceiptHandoffPublisher;
import com.scrollcapture.core.motion.MotionSampler;
import com.scrollcapture.core.stitch.FrameCompositor;
import com.scrollcapture.core.stitch.StitchResult;
import com.scrollcapture.core.trace.SessionMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orchestrates one long-receipt scroll capture from first frame to preview.
 *
 * <p>Owns its collaborators outright: the motion sampler, the capture gate, the frame buffer
 * and the camera handle are never shared with another session.
 *
 * <h3>start()</h3>
 * <ol>
 *   <li>halt whatever capture is active: tick and sensor first, then any outstanding camera
 *       request, then the buffer</li>
 *   <li>reset the frame buffer, start the motion sampler, start the gate tick</li>
 *   <li>issue one unconditional capture, so the session has a frame even if the user never
 *       holds the device steady</li>
 * </ol>
 *
 * <h3>stop()</h3>
 * <p>Halts tick and sensor synchronously, then resolves the outcome:
 * 0 frames → EMPTY, 1 frame → READY with that frame, 2+ frames → composite on the stitch
 * scheduler, READY with the composite, or READY with the first frame if compositing fails.
 *
 * <p>Every capture request is tagged with the session generation current when it was issued.
 * Completions from an older generation (a frame that arrives after stop or after a restart)
 * are dropped, so a reset buffer is never written by a stale callback.
 */
public class CaptureSession {

    private static final Logger log = LoggerFactory.getLogger(CaptureSession.class);

    private final MotionSampler           sampler;
    private final CameraCollaborator      camera;
    private final FrameBuffer             buffer;
    private final FrameCompositor         compositor;
    private final Scheduler               stitchScheduler;
    private final CapturePreview          preview;
    private final ReceiptHandoffPublisher handoffPublisher;
    private final CaptureGate             gate;

    private final AtomicLong generation = new AtomicLong();

    // subscriptions to camera requests still outstanding; replaced whenever capture halts
    private volatile Disposable.Composite pendingCaptures = Disposables.composite();

    private volatile SessionState            state     = SessionState.IDLE;
    private volatile String                  sessionId;
    private volatile FlashMode               flashMode = FlashMode.AUTO;
    private volatile CaptureOutcome          outcome;
    private volatile CaptureFeedbackListener listener  = CaptureFeedbackListener.NO_OP;

    public CaptureSession(MotionSampler sampler,
                          CameraCollaborator camera,
                          FrameBuffer buffer,
                          FrameCompositor compositor,
                          CaptureTimings timings,
                          Scheduler tickScheduler,
                          Scheduler stitchScheduler,
                          CapturePreview preview,
                          ReceiptHandoffPublisher handoffPublisher) {
        this.sampler          = sampler;
        this.camera           = camera;
        this.buffer           = buffer;
        this.compositor       = compositor;
        this.stitchScheduler  = stitchScheduler;
        this.preview          = preview != null ? preview : CapturePreview.NO_OP;
        this.handoffPublisher = handoffPublisher;
        this.gate = new CaptureGate(sampler, camera, this::requestFrame, timings.tickPeriod(), tickScheduler);
    }

    public void setFeedbackListener(CaptureFeedbackListener listener) {
        this.listener = listener != null ? listener : CaptureFeedbackListener.NO_OP;
        gate.setListener(this.listener);
    }

    // ── lifecycle ────────────────────────────────────────────────────────────

    /** Starts a capture with the flash mode of the previous one. */
    public synchronized void start() {
        start(flashMode);
    }

    public synchronized void start(FlashMode flash) {
        if (state == SessionState.CAPTURING) {
            String previous = sessionId;
            SessionMdc.withMdc(previous, () ->
                log.info("[CaptureSession] restart requested, discarding active capture. frames={}",
                         buffer.count()));
            haltCapture();
        }

        generation.incrementAndGet();
        sessionId = UUID.randomUUID().toString();
        flashMode = flash != null ? flash : FlashMode.AUTO;
        outcome   = null;
        buffer.reset();

        sampler.start();
        gate.start();
        state = SessionState.CAPTURING;

        SessionMdc.withMdc(sessionId, () ->
            log.info("[CaptureSession] capture started. flash={}", flashMode));

        requestFrame();
    }

    /**
     * Ends the capture and resolves its outcome. The returned {@link Mono} is already running;
     * subscribing is optional and replays the same outcome. The outcome is also presented to
     * the preview collaborator.
     *
     * @throws IllegalStateException if no capture is in progress
     */
    public synchronized Mono<CaptureOutcome> stop() {
        if (state != SessionState.CAPTURING) {
            throw new IllegalStateException("No capture in progress. state=" + state);
        }
        haltCapture();
        long stoppedGeneration = generation.incrementAndGet();
        String id = sessionId;

        List<BufferedImage> images = buffer.images();
        int count = images.size();
        SessionMdc.withMdc(id, () ->
            log.info("[CaptureSession] capture stopped. frames={}", count));

        if (count == 0) {
            return Mono.just(complete(CaptureOutcome.empty(id), stoppedGeneration));
        }
        if (count == 1) {
            return Mono.just(complete(CaptureOutcome.ready(images.get(0), 1, false, id), stoppedGeneration));
        }

        state = SessionState.STITCHING;
        Mono<CaptureOutcome> stitched = Mono.fromCallable(() -> compositeOrFail(images))
            .subscribeOn(stitchScheduler)
            .map(result -> toOutcome(result, images, id))
            .onErrorResume(e -> {
                SessionMdc.withMdc(id, () ->
                    log.warn("[CaptureSession] stitching failed, falling back to first frame. frames={} reason={}",
                             count, e.getMessage()));
                return Mono.just(CaptureOutcome.ready(images.get(0), count, true, id));
            })
            .map(result -> complete(result, stoppedGeneration))
            .cache();
        stitched.subscribe();
        return stitched;
    }

    /**
     * Discards the current result (or active capture) and starts over.
     */
    public synchronized void retake() {
        SessionMdc.withMdc(sessionId, () -> log.info("[CaptureSession] retake. state={}", state));
        if (state == SessionState.CAPTURING) {
            haltCapture();
        }
        buffer.reset();
        start();
    }

    /**
     * Hands the READY image to the handoff publisher and returns the session to IDLE.
     *
     * @throws IllegalStateException if there is no READY outcome to accept
     */
    public synchronized AcceptedReceipt accept() {
        CaptureOutcome current = outcome;
        if (state != SessionState.READY || current == null || !current.isReady()) {
            throw new IllegalStateException("Nothing to accept. state=" + state);
        }
        AcceptedReceipt receipt = new AcceptedReceipt(
            current.sessionId(), current.image(), current.frameCount(), current.fallback(), Instant.now());
        handoffPublisher.publish(receipt);
        SessionMdc.withMdc(current.sessionId(), () ->
            log.info("[CaptureSession] receipt accepted. frames={} fallback={}",
                     current.frameCount(), current.fallback()));

        buffer.reset();
        outcome = null;
        state   = SessionState.IDLE;
        return receipt;
    }

    /**
     * Abandons the session without producing an outcome.
     */
    public synchronized void cancel() {
        if (state == SessionState.CAPTURING) {
            haltCapture();
        }
        generation.incrementAndGet();
        buffer.reset();
        outcome = null;
        state   = SessionState.IDLE;
        SessionMdc.withMdc(sessionId, () -> log.info("[CaptureSession] cancelled"));
    }

    // ── accessors ────────────────────────────────────────────────────────────

    public SessionState getState() {
        return state;
    }

    public String getSessionId() {
        return sessionId;
    }

    public CaptureOutcome getOutcome() {
        return outcome;
    }

    public int getFrameCount() {
        return buffer.count();
    }

    public double getProgress() {
        return buffer.progress();
    }

    public CaptureStatus status() {
        return new CaptureStatus(
            sessionId, state, buffer.count(), buffer.progress(),
            gate.currentSpeed(), sampler.current(), camera.isInFlight());
    }

    // ── internals ────────────────────────────────────────────────────────────

    /**
     * Tick and sensor are halted before anything touches the buffer. Outstanding camera
     * requests are cancelled, which frees the camera slot for the next session's frame 0.
     */
    private void haltCapture() {
        gate.stop();
        sampler.stop();
        Disposable.Composite cancelled = pendingCaptures;
        pendingCaptures = Disposables.composite();
        cancelled.dispose();
    }

    private void requestFrame() {
        long requestGeneration = generation.get();
        Disposable.Composite owner = pendingCaptures;
        Disposable capture = camera.requestCapture(flashMode.forScrollFrames())
            .subscribe(
                image -> onFrame(requestGeneration, image),
                err -> SessionMdc.withMdc(sessionId, () ->
                    log.warn("[CaptureSession] capture error, frame skipped. reason={}", err.getMessage()))
            );
        if (!capture.isDisposed()) {
            // adding to an owner that was halted meanwhile disposes the capture
            owner.add(capture);
        }
    }

    private void onFrame(long requestGeneration, BufferedImage image) {
        CapturedFrame frame;
        double progress;
        synchronized (this) {
            if (requestGeneration != generation.get() || state != SessionState.CAPTURING) {
                log.debug("[CaptureSession] late frame discarded. requestGeneration={} current={}",
                          requestGeneration, generation.get());
                return;
            }
            try {
                frame = buffer.append(image);
            } catch (FrameRejectedException e) {
                SessionMdc.withMdc(sessionId, () ->
                    log.warn("[CaptureSession] frame rejected, capture continues. reason={}", e.getDetail()));
                return;
            }
            progress = buffer.progress();
        }
        int count = frame.sequenceIndex() + 1;
        SessionMdc.withMdc(sessionId, () ->
            log.debug("[CaptureSession] frame captured. count={} progress={}", count, progress));
        listener.onFrameCaptured(count, progress);
    }

    /** Reactor rethrows JVM-fatal errors instead of signalling them, so an OOM is converted here. */
    private StitchResult compositeOrFail(List<BufferedImage> images) {
        try {
            return compositor.composite(images);
        } catch (OutOfMemoryError e) {
            throw new StitchException("out of memory while compositing " + images.size() + " frames", e);
        }
    }

    private CaptureOutcome toOutcome(StitchResult result, List<BufferedImage> images, String id) {
        if (result.isEmpty() || result.image() == null) {
            return CaptureOutcome.ready(images.get(0), images.size(), true, id);
        }
        return CaptureOutcome.ready(result.image(), images.size(), false, id);
    }

    private CaptureOutcome complete(CaptureOutcome result, long stoppedGeneration) {
        synchronized (this) {
            if (stoppedGeneration != generation.get()) {
                SessionMdc.withMdc(result.sessionId(), () ->
                    log.info("[CaptureSession] outcome superseded by a newer capture, not presented"));
                return result;
            }
            outcome = result;
            state   = result.isReady() ? SessionState.READY : SessionState.EMPTY;
        }
        SessionMdc.withMdc(result.sessionId(), () ->
            log.info("[CaptureSession] outcome ready. status={} frames={} fallback={}",
                     result.status(), result.frameCount(), result.fallback()));
        preview.present(result);
        return result;
    }
}
