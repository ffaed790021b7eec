package com.scrollcapture.core.session;

/**
 * Preview/confirmation screen. Receives every terminal outcome; the user then either
 * retakes ({@link CaptureSession#retake()}) or accepts ({@link CaptureSession#accept()}).
 */
public interface CapturePreview {

    CapturePreview NO_OP = outcome -> {};

    void present(CaptureOutcome outcome);
}
