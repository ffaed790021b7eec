package com.scrollcapture.service.preview;

import com.scrollcapture.core.capture.CaptureFeedbackListener;
import com.scrollcapture.core.motion.ScrollSpeed;
import com.scrollcapture.core.session.CaptureOutcome;
import com.scrollcapture.core.session.CapturePreview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Server-side stand-in for the capture screen: remembers the live guidance and the last
 * presented outcome so REST clients can poll them.
 *
 * <p>Written from the tick, camera and stitch threads, read by request threads; volatile
 * visibility is all it needs since every field is replaced whole.
 */
public class PreviewState implements CapturePreview, CaptureFeedbackListener {

    private static final Logger log = LoggerFactory.getLogger(PreviewState.class);

    private volatile ScrollSpeed    speed;
    private volatile int            framesCaptured;
    private volatile double         progress;
    private volatile Instant        lastFrameAt;
    private volatile CaptureOutcome presented;
    private volatile Instant        presentedAt;

    // ── callbacks ──────────────────────────────────────────────────────────

    @Override
    public void onSpeedChanged(ScrollSpeed speed) {
        this.speed = speed;
    }

    @Override
    public void onFrameCaptured(int frameCount, double progress) {
        this.framesCaptured = frameCount;
        this.progress       = progress;
        this.lastFrameAt    = Instant.now();
    }

    @Override
    public void present(CaptureOutcome outcome) {
        this.presented   = outcome;
        this.presentedAt = Instant.now();
        log.info("[Preview] outcome presented. status={} frames={} fallback={}",
                 outcome.status(), outcome.frameCount(), outcome.fallback());
    }

    public void clear() {
        this.speed          = null;
        this.framesCaptured = 0;
        this.progress       = 0.0;
        this.lastFrameAt    = null;
        this.presented      = null;
        this.presentedAt    = null;
    }

    // ── accessors ──────────────────────────────────────────────────────────

    public ScrollSpeed    getSpeed()          { return speed; }
    public int            getFramesCaptured() { return framesCaptured; }
    public double         getProgress()       { return progress; }
    public Instant        getLastFrameAt()    { return lastFrameAt; }
    public CaptureOutcome getPresented()      { return presented; }
    public Instant        getPresentedAt()    { return presentedAt; }

    /** Guidance line shown under the viewfinder; empty before the first tick. */
    public String getGuidance() {
        ScrollSpeed current = speed;
        return current != null ? current.guidance() : "";
    }
}
