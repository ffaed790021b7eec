package com.scrollcapture.core.session;

/**
 * Lifecycle of a {@link CaptureSession}.
 *
 * <pre>
 * IDLE ──start()──► CAPTURING ──stop()──► STITCHING ──► READY
 *                        │                                ▲
 *                        ├── stop(), 1 frame ─────────────┘
 *                        └── stop(), 0 frames ──► EMPTY
 * </pre>
 *
 * <p>{@code start()} is legal from every state and always begins a fresh capture.
 */
public enum SessionState {
    IDLE,
    CAPTURING,
    STITCHING,
    READY,
    EMPTY
}
