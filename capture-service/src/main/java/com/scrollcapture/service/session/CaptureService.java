package com.scrollcapture.service.session;

import com.scrollcapture.core.camera.FlashMode;
import com.scrollcapture.core.handoff.AcceptedReceipt;
import com.scrollcapture.core.session.CaptureOutcome;
import com.scrollcapture.core.session.CaptureSession;
import com.scrollcapture.core.session.CaptureStatus;
import com.scrollcapture.core.session.SessionState;
import com.scrollcapture.service.device.ReceiptReplayPhotoSource;
import com.scrollcapture.service.device.ScriptedMotionSensor;
import com.scrollcapture.service.preview.PreviewState;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Hosts the single capture session of this service and keeps the simulated devices and the
 * preview in step with it.
 */
public class CaptureService {

    private final CaptureSession           session;
    private final PreviewState             preview;
    private final ReceiptReplayPhotoSource replaySource;
    private final ScriptedMotionSensor     motionSensor;

    public CaptureService(CaptureSession session,
                          PreviewState preview,
                          ReceiptReplayPhotoSource replaySource,
                          ScriptedMotionSensor motionSensor) {
        this.session      = session;
        this.preview      = preview;
        this.replaySource = replaySource;
        this.motionSensor = motionSensor;
    }

    public synchronized CaptureStatus start(FlashMode flash) {
        replaySource.rewind();
        preview.clear();
        session.start(flash);
        return session.status();
    }

    /** Errors with {@link IllegalStateException} when nothing is being captured. */
    public Mono<CaptureOutcome> stop() {
        return Mono.defer(session::stop);
    }

    public synchronized CaptureStatus retake() {
        replaySource.rewind();
        preview.clear();
        session.retake();
        return session.status();
    }

    /** @throws IllegalStateException when there is no READY outcome */
    public synchronized AcceptedReceipt accept() {
        AcceptedReceipt receipt = session.accept();
        preview.clear();
        return receipt;
    }

    public synchronized void cancel() {
        session.cancel();
        preview.clear();
    }

    public CaptureStatus status() {
        return session.status();
    }

    public Optional<CaptureOutcome> readyOutcome() {
        CaptureOutcome outcome = session.getOutcome();
        if (session.getState() != SessionState.READY || outcome == null || !outcome.isReady()) {
            return Optional.empty();
        }
        return Optional.of(outcome);
    }

    public PreviewState getPreview() {
        return preview;
    }

    public void updateMotion(double vertical, double lateral, double depth) {
        motionSensor.update(vertical, lateral, depth);
    }
}
