package com.scrollcapture.core.exception;

/**
 * Base of every failure raised inside the capture pipeline.
 *
 * <p>Carries the pipeline component that failed ({@code FrameBuffer}, {@code Stitcher}, ...)
 * and prefixes the message with it, so a log line reads {@code [Stitcher] canvas ...}.
 * Every capture failure is local to one session: callers log it and carry on, and the
 * session can always be retaken.
 */
public class CaptureException extends RuntimeException {

    private final String component;

    protected CaptureException(String component, String message) {
        this(component, message, null);
    }

    protected CaptureException(String component, String message, Throwable cause) {
        super(tag(component, message), cause);
        this.component = component;
    }

    /** Pipeline component that raised this failure. */
    public String getComponent() {
        return component;
    }

    /** Message without the component prefix. */
    public String getDetail() {
        String message = getMessage();
        String prefix  = tag(component, "");
        return message.startsWith(prefix) ? message.substring(prefix.length()) : message;
    }

    private static String tag(String component, String message) {
        return "[" + component + "] " + message;
    }
}
