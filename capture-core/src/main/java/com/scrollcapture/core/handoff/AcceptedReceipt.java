package com.scrollcapture.core.handoff;

import java.awt.image.BufferedImage;
import java.time.Instant;

/**
 * A capture the user confirmed, ready to leave the capture pipeline.
 */
public record AcceptedReceipt(
    String        sessionId,
    BufferedImage image,
    int           frameCount,
    boolean       stitchFallback,
    Instant       acceptedAt
) {}
