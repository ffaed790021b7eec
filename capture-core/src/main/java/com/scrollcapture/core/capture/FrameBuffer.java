package com.scrollcapture.core.capture;

import com.scrollcapture.core.exception.FrameRejectedException;
import com.scrollcapture.core.stitch.FrameImages;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only frame store for the active capture session.
 *
 * <p>Append order is capture order; nothing is reordered or deduplicated. The first frame
 * of a session fixes the frame size. A later frame with a different width is scaled to that
 * width; if its height still disagrees it is rejected with a {@link FrameRejectedException}
 * and the buffer is left unchanged.
 *
 * <p>The capture-completion callback is the single writer; progress readers poll from other
 * threads, so every access goes through the buffer's monitor.
 */
public class FrameBuffer {

    /** Segment count at which progress saturates. Not a cap: more frames are still accepted. */
    public static final int EXPECTED_SEGMENTS = 20;

    private final List<CapturedFrame> frames = new ArrayList<>();
    private int frameWidth;
    private int frameHeight;

    /**
     * Appends {@code image} as the next frame.
     *
     * @return the stored frame, possibly width-normalized
     * @throws FrameRejectedException if the normalized height does not match the session's
     */
    public synchronized CapturedFrame append(BufferedImage image) {
        BufferedImage stored = image;
        if (frames.isEmpty()) {
            frameWidth  = image.getWidth();
            frameHeight = image.getHeight();
        } else {
            stored = FrameImages.scaleToWidth(image, frameWidth);
            if (stored.getHeight() != frameHeight) {
                throw new FrameRejectedException(frameHeight, stored.getHeight());
            }
        }
        CapturedFrame frame = new CapturedFrame(stored, frames.size());
        frames.add(frame);
        return frame;
    }

    public synchronized void reset() {
        frames.clear();
        frameWidth  = 0;
        frameHeight = 0;
    }

    public synchronized int count() {
        return frames.size();
    }

    /** {@code min(count / 20, 1.0)}: drives the capture progress ring. */
    public synchronized double progress() {
        return Math.min((double) frames.size() / EXPECTED_SEGMENTS, 1.0);
    }

    /** Immutable copy of the frames in capture order. */
    public synchronized List<CapturedFrame> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(frames));
    }

    /** Immutable copy of the frame images in capture order. */
    public synchronized List<BufferedImage> images() {
        List<BufferedImage> images = new ArrayList<>(frames.size());
        for (CapturedFrame frame : frames) {
            images.add(frame.image());
        }
        return Collections.unmodifiableList(images);
    }
}
