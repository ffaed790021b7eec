package com.scrollcapture.core.session;

import java.awt.image.BufferedImage;

/**
 * Terminal result of one capture session, handed to the preview collaborator.
 *
 * @param status     {@link Status#READY} with an image, or {@link Status#EMPTY} when nothing was captured
 * @param image      final image; null when EMPTY
 * @param frameCount frames captured in the session
 * @param fallback   true when stitching failed and the first frame stands in for the composite
 * @param sessionId  id of the session that produced it
 */
public record CaptureOutcome(
    Status        status,
    BufferedImage image,
    int           frameCount,
    boolean       fallback,
    String        sessionId
) {

    public enum Status { READY, EMPTY }

    public static CaptureOutcome ready(BufferedImage image, int frameCount, boolean fallback, String sessionId) {
        return new CaptureOutcome(Status.READY, image, frameCount, fallback, sessionId);
    }

    public static CaptureOutcome empty(String sessionId) {
        return new CaptureOutcome(Status.EMPTY, null, 0, false, sessionId);
    }

    public boolean isReady() {
        return status == Status.READY;
    }
}
