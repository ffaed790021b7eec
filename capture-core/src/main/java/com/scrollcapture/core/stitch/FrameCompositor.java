package com.scrollcapture.core.stitch;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Strategy for turning an ordered frame sequence (top of the receipt first) into one image.
 *
 * <p>Implementations must return {@link StitchResult#empty()} for an empty list and the
 * frame itself for a single-element list. Failures while compositing surface as
 * {@link com.scrollcapture.core.exception.StitchException}; the capture session recovers
 * from them.
 *
 * <p>Two implementations ship:
 * <ul>
 *   <li>{@link BlendedOverlapCompositor}: fixed overlap with a linear alpha cross-fade (default)</li>
 *   <li>{@link GapStackCompositor}: plain stacking with a thin separator</li>
 * </ul>
 */
public interface FrameCompositor {

    StitchResult composite(List<BufferedImage> frames);
}
