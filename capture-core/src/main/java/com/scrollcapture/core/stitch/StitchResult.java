package com.scrollcapture.core.stitch;

import java.awt.image.BufferedImage;

/**
 * Outcome of compositing a frame sequence.
 *
 * <p>{@link Kind#EMPTY} is a normal outcome for an empty sequence, not a failure.
 * {@link Kind#SINGLE} carries the lone input frame itself, untouched.
 */
public record StitchResult(Kind kind, BufferedImage image) {

    public enum Kind { EMPTY, SINGLE, COMPOSITED }

    public static StitchResult empty() {
        return new StitchResult(Kind.EMPTY, null);
    }

    public static StitchResult single(BufferedImage image) {
        return new StitchResult(Kind.SINGLE, image);
    }

    public static StitchResult composited(BufferedImage image) {
        return new StitchResult(Kind.COMPOSITED, image);
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }
}
