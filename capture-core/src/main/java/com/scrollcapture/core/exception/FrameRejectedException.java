package com.scrollcapture.core.exception;

/**
 * Raised when a captured frame cannot be reconciled with the dimensions fixed by the
 * first frame of the session. Recoverable: the session keeps capturing.
 */
public class FrameRejectedException extends CaptureException {

    private final int expectedHeight;
    private final int actualHeight;

    public FrameRejectedException(int expectedHeight, int actualHeight) {
        super("FrameBuffer", String.format(
            "frame height %d does not match session height %d after width normalization",
            actualHeight, expectedHeight));
        this.expectedHeight = expectedHeight;
        this.actualHeight   = actualHeight;
    }

    public int getExpectedHeight() {
        return expectedHeight;
    }

    public int getActualHeight() {
        return actualHeight;
    }
}
