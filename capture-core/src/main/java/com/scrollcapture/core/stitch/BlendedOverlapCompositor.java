package com.scrollcapture.core.stitch;

import com.scrollcapture.core.exception.StitchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Default compositor: lays frames out at a fixed vertical advance and cross-fades each
 * frame into its predecessor across the overlap band.
 *
 * <h3>Layout (frame size {@code W × H}, {@code n} frames)</h3>
 * <pre>
 * blendHeight     = H · overlapRatio
 * effectiveHeight = H · (1 − overlapRatio)
 * canvas          = W × round(H + (n − 1) · effectiveHeight), opaque white
 * frame 0         → y = 0, drawn whole
 * frame i ≥ 1     → y = round(i · effectiveHeight)
 *                   band  [y, y + strips·strip)   drawn strip by strip, strip k at alpha k/strips
 *                   rest  [y + strips·strip, y+H) drawn at full opacity
 * </pre>
 *
 * <p>The lower part of a frame lands on empty canvas, so it is always correct. The band is
 * a linear vertical alpha ramp from 0 at the top (previous frame shows through) towards 1
 * at the bottom (current frame takes over), which hides the seam.
 *
 * <p>No registration happens: the fixed overlap ratio stands in for the real overlap, so a
 * user who scrolled at a very uneven speed gets visible seams or repeated lines.
 */
public class BlendedOverlapCompositor implements FrameCompositor {

    private static final Logger log = LoggerFactory.getLogger(BlendedOverlapCompositor.class);

    private final StitchConfig config;

    public BlendedOverlapCompositor(StitchConfig config) {
        this.config = config;
    }

    public StitchConfig getConfig() {
        return config;
    }

    @Override
    public StitchResult composite(List<BufferedImage> frames) {
        if (frames == null || frames.isEmpty()) {
            return StitchResult.empty();
        }
        if (frames.size() == 1) {
            return StitchResult.single(frames.get(0));
        }

        BufferedImage first = frames.get(0);
        int width  = first.getWidth();
        int height = first.getHeight();
        int n      = frames.size();

        int canvasHeight = config.canvasHeight(height, n);
        int strips       = config.blendStripCount(height);
        int stripHeight  = config.blendStripHeightPx();
        int bandHeight   = strips * stripHeight;

        BufferedImage canvas = allocateCanvas(width, canvasHeight);
        Graphics2D g = canvas.createGraphics();
        try {
            g.drawImage(first, 0, 0, width, height, null);

            for (int i = 1; i < n; i++) {
                BufferedImage frame = frames.get(i);
                int y = config.frameOffset(height, i);

                // lower part: nothing beneath it yet
                if (height > bandHeight) {
                    g.setComposite(AlphaComposite.SrcOver);
                    g.setClip(0, y + bandHeight, width, height - bandHeight);
                    g.drawImage(frame, 0, y, width, height, null);
                }

                // overlap band: linear ramp, one constant-alpha strip at a time
                for (int k = 0; k < strips; k++) {
                    float alpha = stripAlpha(k, strips);
                    g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, alpha));
                    g.setClip(0, y + k * stripHeight, width, stripHeight);
                    g.drawImage(frame, 0, y, width, height, null);
                }
            }
        } finally {
            g.dispose();
        }

        log.debug("[Stitcher] composited frames={} frameSize={}x{} canvasHeight={} strips={}",
                  n, width, height, canvasHeight, strips);
        return StitchResult.composited(canvas);
    }

    /** Alpha of blend strip {@code k} out of {@code strips}; the ramp used by {@link #composite}. */
    public static float stripAlpha(int k, int strips) {
        return strips == 0 ? 1f : (float) k / strips;
    }

    private static BufferedImage allocateCanvas(int width, int height) {
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new StitchException(String.format("canvas %dx%d exceeds addressable pixel count", width, height));
        }
        try {
            return FrameImages.opaqueCanvas(width, height, Color.WHITE);
        } catch (OutOfMemoryError e) {
            throw new StitchException(String.format("canvas %dx%d could not be allocated", width, height), e);
        }
    }
}
