package com.scrollcapture.core.camera;

import reactor.core.publisher.Mono;

import java.awt.image.BufferedImage;

/**
 * Camera boundary used by the capture pipeline.
 *
 * <p>Single-slot: at most one request may be outstanding. {@link #isInFlight()} is true from
 * the moment a request is subscribed until it completes, fails or times out. A request made
 * while another is in flight completes empty.
 */
public interface CameraCollaborator {

    boolean isInFlight();

    Mono<BufferedImage> requestCapture(FlashMode flashMode);
}
