package com.scrollcapture.core.stitch;

import com.scrollcapture.core.exception.StitchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Stacks frames top to bottom with a thin light-grey separator and no overlap handling.
 *
 * <p>Frames are first normalized to the widest frame; widths within
 * {@value #WIDTH_TOLERANCE_PX} px are drawn as they are. Useful when the receipt is captured
 * section by section rather than in one continuous sweep and downstream text extraction
 * copes with the repeated lines.
 */
public class GapStackCompositor implements FrameCompositor {

    private static final Logger log = LoggerFactory.getLogger(GapStackCompositor.class);

    static final int WIDTH_TOLERANCE_PX = 10;

    private static final Color SEPARATOR = new Color(0.9f, 0.9f, 0.9f);

    private final StitchConfig config;

    public GapStackCompositor(StitchConfig config) {
        this.config = config;
    }

    @Override
    public StitchResult composite(List<BufferedImage> frames) {
        if (frames == null || frames.isEmpty()) {
            return StitchResult.empty();
        }
        if (frames.size() == 1) {
            return StitchResult.single(frames.get(0));
        }

        int targetWidth = frames.stream().mapToInt(BufferedImage::getWidth).max().orElse(0);
        List<BufferedImage> normalized = new ArrayList<>(frames.size());
        for (BufferedImage frame : frames) {
            normalized.add(Math.abs(frame.getWidth() - targetWidth) < WIDTH_TOLERANCE_PX
                ? frame
                : FrameImages.scaleToWidth(frame, targetWidth));
        }

        int gap = config.stackGapPx();
        long totalHeight = (long) gap * (normalized.size() - 1);
        for (BufferedImage frame : normalized) {
            totalHeight += frame.getHeight();
        }
        if (totalHeight * targetWidth > Integer.MAX_VALUE) {
            throw new StitchException(String.format("stack %dx%d exceeds addressable pixel count",
                                                    targetWidth, totalHeight));
        }

        BufferedImage canvas;
        try {
            canvas = FrameImages.opaqueCanvas(targetWidth, (int) totalHeight, Color.WHITE);
        } catch (OutOfMemoryError e) {
            throw new StitchException("stack canvas could not be allocated", e);
        }

        Graphics2D g = canvas.createGraphics();
        try {
            int y = 0;
            for (int i = 0; i < normalized.size(); i++) {
                BufferedImage frame = normalized.get(i);
                g.drawImage(frame, 0, y, null);
                y += frame.getHeight();
                if (i < normalized.size() - 1 && gap > 0) {
                    g.setColor(SEPARATOR);
                    g.fillRect(0, y, targetWidth, gap);
                    y += gap;
                }
            }
        } finally {
            g.dispose();
        }

        log.debug("[Stitcher] stacked frames={} width={} height={}", normalized.size(), targetWidth, totalHeight);
        return StitchResult.composited(canvas);
    }
}
