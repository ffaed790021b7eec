package com.scrollcapture.service.device;

import com.scrollcapture.core.camera.FlashMode;
import com.scrollcapture.core.camera.PhotoSource;
import com.scrollcapture.core.stitch.FrameImages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulated camera that replays a tall receipt image as the frames a phone would see while
 * scrolling down it.
 *
 * <p>Each capture returns the next {@code frameHeight}-tall window and advances a cursor by
 * {@code frameHeight · (1 − overlapRatio)}, so consecutive frames overlap the way the
 * compositor assumes. Once the bottom of the receipt is reached, the last window repeats.
 * {@link #rewind()} moves the cursor back to the top for a new capture.
 */
public class ReceiptReplayPhotoSource implements PhotoSource {

    private static final Logger log = LoggerFactory.getLogger(ReceiptReplayPhotoSource.class);

    private final BufferedImage receipt;
    private final int           frameHeight;
    private final int           step;
    private final Duration      latency;

    private final AtomicInteger cursor = new AtomicInteger(0);

    public ReceiptReplayPhotoSource(BufferedImage receipt, int frameHeight, double overlapRatio, Duration latency) {
        if (frameHeight < 1) {
            throw new IllegalArgumentException("frameHeight must be >= 1: " + frameHeight);
        }
        this.receipt     = receipt;
        this.frameHeight = Math.min(frameHeight, receipt.getHeight());
        this.step        = Math.max(1, (int) Math.round(this.frameHeight * (1.0 - overlapRatio)));
        this.latency     = latency != null ? latency : Duration.ZERO;
        log.info("[ReceiptReplay] loaded. receipt={}x{} frameHeight={} step={} frames={}",
                 receipt.getWidth(), receipt.getHeight(), this.frameHeight, step, frameCount());
    }

    @Override
    public Mono<BufferedImage> capture(FlashMode flashMode) {
        Mono<BufferedImage> frame = Mono.fromCallable(this::nextWindow);
        return latency.isZero() ? frame : frame.delayElement(latency);
    }

    /** Moves the cursor back to the top of the receipt. */
    public void rewind() {
        cursor.set(0);
    }

    public int getCursor() {
        return cursor.get();
    }

    /** Distinct windows before the replay starts repeating the bottom one. */
    public int frameCount() {
        int travel = receipt.getHeight() - frameHeight;
        return travel <= 0 ? 1 : (travel + step - 1) / step + 1;
    }

    private BufferedImage nextWindow() {
        int idx    = cursor.getAndIncrement();
        int maxTop = receipt.getHeight() - frameHeight;
        int top    = (int) Math.min((long) idx * step, maxTop);

        BufferedImage window = new BufferedImage(receipt.getWidth(), frameHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = window.createGraphics();
        try {
            g.drawImage(receipt, 0, -top, null);
        } finally {
            g.dispose();
        }
        log.debug("[ReceiptReplay] frame served. idx={} top={}", idx, top);
        return window;
    }

    // ── receipt sources ──────────────────────────────────────────────────────

    public static BufferedImage load(Path path) throws IOException {
        if (!Files.isReadable(path)) {
            throw new IOException("receipt image not readable: " + path);
        }
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("unsupported image format: " + path);
        }
        return image;
    }

    /**
     * Draws a plain receipt: white paper, a header block, then rows of dark bars standing in
     * for item lines with right-aligned prices. Bars rather than glyphs, so no fonts are needed.
     */
    public static BufferedImage synthetic(int width, int height) {
        BufferedImage paper = FrameImages.opaqueCanvas(width, height, Color.WHITE);
        Graphics2D g = paper.createGraphics();
        try {
            int margin = Math.max(4, width / 20);
            int line   = Math.max(6, width / 30);

            g.setColor(Color.DARK_GRAY);
            g.fillRect(width / 4, margin, width / 2, line * 2);

            int row = 0;
            for (int y = margin + line * 4; y + line < height - margin; y += line * 2, row++) {
                int itemWidth = (width / 3) + (row * 37) % (width / 4);
                g.setColor(row % 8 == 7 ? Color.BLACK : Color.GRAY);
                g.fillRect(margin, y, itemWidth, line);
                g.fillRect(width - margin - width / 6, y, width / 6, line);
            }
        } finally {
            g.dispose();
        }
        return paper;
    }
}
