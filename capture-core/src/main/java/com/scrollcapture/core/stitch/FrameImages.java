package com.scrollcapture.core.stitch;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Small Java2D helpers shared by the frame buffer and the compositors.
 */
public final class FrameImages {

    private FrameImages() {}

    /**
     * Scales {@code image} to {@code targetWidth}, preserving aspect ratio. Returns the same
     * instance when the width already matches.
     */
    public static BufferedImage scaleToWidth(BufferedImage image, int targetWidth) {
        if (image.getWidth() == targetWidth) {
            return image;
        }
        double scale = (double) targetWidth / image.getWidth();
        int targetHeight = Math.max(1, (int) Math.round(image.getHeight() * scale));

        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    /** Opaque canvas pre-filled with {@code background}. */
    public static BufferedImage opaqueCanvas(int width, int height, Color background) {
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return canvas;
    }
}
