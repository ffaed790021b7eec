package com.scrollcapture.core.camera;

import reactor.core.publisher.Mono;

import java.awt.image.BufferedImage;

/**
 * Raw still-capture device. One call, one photo; no concurrency guarantees of its own.
 *
 * <p>Implementations complete with the decoded, upright image, complete empty when the
 * device produced nothing, or error on a device failure.
 */
public interface PhotoSource {

    Mono<BufferedImage> capture(FlashMode flashMode);
}
