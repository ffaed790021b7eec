package com.scrollcapture.core.camera;

public enum FlashMode {
    OFF,
    ON,
    AUTO;

    /**
     * Flash used for the repeated frames of a scroll capture: the user can switch it off,
     * otherwise the device decides per frame.
     */
    public FlashMode forScrollFrames() {
        return this == OFF ? OFF : AUTO;
    }
}
