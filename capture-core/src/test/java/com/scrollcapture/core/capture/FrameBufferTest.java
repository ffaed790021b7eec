package com.scrollcapture.core.capture;

import com.scrollcapture.core.exception.FrameRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameBufferTest {

    private static BufferedImage frame(int w, int h) {
        return new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
    }

    @Test
    @DisplayName("frames keep append order and sequence indices")
    void appendOrder() {
        FrameBuffer buffer = new FrameBuffer();
        BufferedImage a = frame(10, 20);
        BufferedImage b = frame(10, 20);
        BufferedImage c = frame(10, 20);

        buffer.append(a);
        buffer.append(b);
        buffer.append(c);

        List<CapturedFrame> frames = buffer.snapshot();
        assertEquals(3, buffer.count());
        assertSame(a, frames.get(0).image());
        assertSame(b, frames.get(1).image());
        assertSame(c, frames.get(2).image());
        assertEquals(2, frames.get(2).sequenceIndex());
    }

    @Test
    @DisplayName("progress = count / 20, saturating at 1.0 without capping frames")
    void progressSaturates() {
        FrameBuffer buffer = new FrameBuffer();
        assertEquals(0.0, buffer.progress());

        for (int i = 0; i < 5; i++) {
            buffer.append(frame(10, 20));
        }
        assertEquals(0.25, buffer.progress(), 1e-12);

        for (int i = 0; i < 20; i++) {
            buffer.append(frame(10, 20));
        }
        assertEquals(25, buffer.count());
        assertEquals(1.0, buffer.progress());
    }

    @Test
    @DisplayName("reset() empties the buffer and releases the frame size")
    void reset() {
        FrameBuffer buffer = new FrameBuffer();
        buffer.append(frame(10, 20));
        buffer.reset();

        assertEquals(0, buffer.count());
        assertDoesNotThrow(() -> buffer.append(frame(30, 40)));
    }

    @Test
    @DisplayName("wider frame with the same aspect is scaled to the session width")
    void widthNormalization() {
        FrameBuffer buffer = new FrameBuffer();
        buffer.append(frame(10, 20));

        CapturedFrame scaled = buffer.append(frame(20, 40));
        assertEquals(10, scaled.image().getWidth());
        assertEquals(20, scaled.image().getHeight());
    }

    @Test
    @DisplayName("frame whose height cannot be reconciled is rejected, buffer unchanged")
    void mismatchRejected() {
        FrameBuffer buffer = new FrameBuffer();
        buffer.append(frame(10, 20));

        FrameRejectedException e = assertThrows(FrameRejectedException.class,
            () -> buffer.append(frame(10, 25)));
        assertEquals(20, e.getExpectedHeight());
        assertEquals(25, e.getActualHeight());
        assertEquals("FrameBuffer", e.getComponent());
        assertEquals(1, buffer.count());
    }

    @Test
    @DisplayName("snapshot is immutable")
    void snapshotImmutable() {
        FrameBuffer buffer = new FrameBuffer();
        buffer.append(frame(10, 20));
        assertThrows(UnsupportedOperationException.class,
            () -> buffer.snapshot().add(new CapturedFrame(frame(10, 20), 1)));
        assertThrows(UnsupportedOperationException.class,
            () -> buffer.images().clear());
    }
}
