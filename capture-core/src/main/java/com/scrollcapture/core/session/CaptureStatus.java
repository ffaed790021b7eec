package com.scrollcapture.core.session;

import com.scrollcapture.core.motion.ScrollSpeed;
import com.scrollcapture.core.motion.SmoothedMotion;

/**
 * Point-in-time view of a session for polling UIs.
 */
public record CaptureStatus(
    String         sessionId,
    SessionState   state,
    int            frameCount,
    double         progress,
    ScrollSpeed    speed,
    SmoothedMotion motion,
    boolean        captureInFlight
) {}
