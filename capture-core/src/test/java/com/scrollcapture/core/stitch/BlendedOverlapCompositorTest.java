package com.scrollcapture.core.stitch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlendedOverlapCompositorTest {

    private final BlendedOverlapCompositor compositor = new BlendedOverlapCompositor(StitchConfig.defaults());

    private static BufferedImage frame(int width, int height, Color fill) {
        return FrameImages.opaqueCanvas(width, height, fill);
    }

    private static int grey(BufferedImage image, int y) {
        return new Color(image.getRGB(image.getWidth() / 2, y)).getRed();
    }

    @Nested
    @DisplayName("degenerate inputs")
    class DegenerateTests {

        @Test
        @DisplayName("empty list → EMPTY, no throw")
        void emptyList() {
            StitchResult result = compositor.composite(Collections.emptyList());
            assertTrue(result.isEmpty());
            assertNull(result.image());
        }

        @Test
        @DisplayName("null list → EMPTY")
        void nullList() {
            assertTrue(compositor.composite(null).isEmpty());
        }

        @Test
        @DisplayName("single frame → the same instance, untouched")
        void singleFrame() {
            BufferedImage only = frame(20, 100, Color.BLUE);
            StitchResult result = compositor.composite(List.of(only));
            assertEquals(StitchResult.Kind.SINGLE, result.kind());
            assertSame(only, result.image());
        }
    }

    @Nested
    @DisplayName("canvas geometry")
    class GeometryTests {

        @Test
        @DisplayName("two 1000 px frames → 1620 px canvas")
        void twoFrames() {
            BufferedImage f = frame(20, 1000, Color.GRAY);
            BufferedImage out = compositor.composite(List.of(f, f)).image();
            assertEquals(1620, out.getHeight());
            assertEquals(20, out.getWidth());
        }

        @Test
        @DisplayName("five 1000 px frames → 3480 px canvas")
        void fiveFrames() {
            BufferedImage f = frame(20, 1000, Color.GRAY);
            StitchResult result = compositor.composite(List.of(f, f, f, f, f));
            assertEquals(StitchResult.Kind.COMPOSITED, result.kind());
            assertEquals(3480, result.image().getHeight());
        }

        @Test
        @DisplayName("canvas is opaque")
        void opaqueCanvas() {
            BufferedImage f = frame(20, 100, Color.GRAY);
            BufferedImage out = compositor.composite(List.of(f, f)).image();
            assertFalse(out.getColorModel().hasAlpha());
        }
    }

    @Nested
    @DisplayName("overlap band")
    class BlendTests {

        // H=100: advance 62, band 19 strips of 2 px at rows 62..99
        private final BufferedImage out = compositor.composite(
            List.of(frame(20, 100, Color.BLACK), frame(20, 100, Color.WHITE))).image();

        @Test
        @DisplayName("frame 0 shows untouched above the band")
        void aboveBand() {
            assertEquals(162, out.getHeight());
            for (int y = 0; y < 62; y++) {
                assertEquals(0, grey(out, y), "row " + y);
            }
        }

        @Test
        @DisplayName("band brightness ramps monotonically from previous frame to current")
        void monotonicRamp() {
            int previous = -1;
            for (int y = 62; y < 100; y++) {
                int value = grey(out, y);
                assertTrue(value >= previous, "row " + y + " darker than row above");
                previous = value;
            }
            assertEquals(0, grey(out, 62));
            assertTrue(grey(out, 99) > 200);
        }

        @Test
        @DisplayName("lower part of the frame is drawn at full opacity")
        void belowBand() {
            for (int y = 100; y < 162; y++) {
                assertEquals(255, grey(out, y), "row " + y);
            }
        }

        @Test
        @DisplayName("stripAlpha is linear from 0 and stays below 1")
        void stripAlpha() {
            int strips = StitchConfig.defaults().blendStripCount(1000);
            assertEquals(190, strips);
            float previous = -1f;
            for (int k = 0; k < strips; k++) {
                float alpha = BlendedOverlapCompositor.stripAlpha(k, strips);
                assertTrue(alpha >= previous);
                assertTrue(alpha < 1f);
                previous = alpha;
            }
            assertEquals(0f, BlendedOverlapCompositor.stripAlpha(0, strips));
            assertEquals(1f, BlendedOverlapCompositor.stripAlpha(0, 0));
        }
    }
}
