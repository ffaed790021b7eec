package com.scrollcapture.core.capture;

/**
 * What a single {@link CaptureGate} tick decided.
 */
public enum GateDecision {
    /** Device stable and camera idle: one capture request issued. */
    CAPTURE_ISSUED,
    /** Device shaking or tilted: no request this tick. */
    SKIPPED_UNSTABLE,
    /** Previous request still outstanding: no request this tick. */
    SKIPPED_IN_FLIGHT
}
