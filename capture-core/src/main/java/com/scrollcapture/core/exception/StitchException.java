package com.scrollcapture.core.exception;

public class StitchException extends CaptureException {

    public StitchException(String message) {
        super("Stitcher", message);
    }

    public StitchException(String message, Throwable cause) {
        super("Stitcher", message, cause);
    }
}
