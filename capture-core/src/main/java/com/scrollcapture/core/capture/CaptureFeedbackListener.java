package com.scrollcapture.core.capture;

import com.scrollcapture.core.motion.ScrollSpeed;

/**
 * Live feedback for whatever renders the capture screen. Called from scheduler threads;
 * implementations must not block.
 */
public interface CaptureFeedbackListener {

    CaptureFeedbackListener NO_OP = new CaptureFeedbackListener() {};

    /** Refreshed on every gate tick, whether or not a capture was issued. */
    default void onSpeedChanged(ScrollSpeed speed) {}

    /** A frame was accepted into the buffer. */
    default void onFrameCaptured(int frameCount, double progress) {}
}
