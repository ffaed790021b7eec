package com.scrollcapture.core.stitch;

/**
 * Immutable stitching constants.
 *
 * <p>{@code overlapRatio} and {@code blendStripHeightPx} are empirical values carried over
 * unchanged from the capture app; they are configuration, not tuning targets.
 *
 * @param overlapRatio        fraction of each frame height assumed to repeat the previous frame
 * @param blendStripHeightPx  height of one constant-alpha strip in the blend band
 * @param stackGapPx          separator height used by {@link GapStackCompositor}
 */
public record StitchConfig(
    double overlapRatio,
    int    blendStripHeightPx,
    int    stackGapPx
) {

    public static final double DEFAULT_OVERLAP_RATIO      = 0.38;
    public static final int    DEFAULT_BLEND_STRIP_HEIGHT = 2;
    public static final int    DEFAULT_STACK_GAP          = 4;

    public StitchConfig {
        if (!(overlapRatio >= 0.0 && overlapRatio < 1.0)) {
            throw new IllegalArgumentException("overlapRatio must be in [0, 1): " + overlapRatio);
        }
        if (blendStripHeightPx < 1) {
            throw new IllegalArgumentException("blendStripHeightPx must be >= 1: " + blendStripHeightPx);
        }
        if (stackGapPx < 0) {
            throw new IllegalArgumentException("stackGapPx must be >= 0: " + stackGapPx);
        }
    }

    public static StitchConfig defaults() {
        return new StitchConfig(DEFAULT_OVERLAP_RATIO, DEFAULT_BLEND_STRIP_HEIGHT, DEFAULT_STACK_GAP);
    }

    /** Height of the band cross-faded into the previous frame. */
    public double blendHeight(int frameHeight) {
        return frameHeight * overlapRatio;
    }

    /** Vertical advance between consecutive frames on the canvas. */
    public double effectiveHeight(int frameHeight) {
        return frameHeight * (1.0 - overlapRatio);
    }

    /** Number of whole strips that fit in the blend band. */
    public int blendStripCount(int frameHeight) {
        return (int) (blendHeight(frameHeight) / blendStripHeightPx);
    }

    /** {@code H + (n - 1) * effectiveHeight}, rounded to whole pixels; 0 for no frames. */
    public int canvasHeight(int frameHeight, int frameCount) {
        if (frameCount <= 0) {
            return 0;
        }
        return (int) Math.round(frameHeight + (frameCount - 1) * effectiveHeight(frameHeight));
    }

    /** Canvas row at which frame {@code index} starts. */
    public int frameOffset(int frameHeight, int index) {
        return (int) Math.round(index * effectiveHeight(frameHeight));
    }
}
