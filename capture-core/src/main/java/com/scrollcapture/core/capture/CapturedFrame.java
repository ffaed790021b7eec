package com.scrollcapture.core.capture;

import java.awt.image.BufferedImage;

/**
 * One frame of a scroll capture, in capture order starting at 0.
 */
public record CapturedFrame(BufferedImage image, int sequenceIndex) {}
