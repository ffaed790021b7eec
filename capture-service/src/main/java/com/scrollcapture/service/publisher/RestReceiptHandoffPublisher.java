package com.scrollcapture.service.publisher;

import com.scrollcapture.core.handoff.AcceptedReceipt;
import com.scrollcapture.core.handoff.ReceiptHandoffPublisher;
import com.scrollcapture.core.trace.SessionMdc;
import com.scrollcapture.service.image.PngCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * REST-based implementation of {@link ReceiptHandoffPublisher}.
 *
 * <p>Encodes the accepted image as PNG on {@code encodeScheduler} and POSTs it to the upload
 * service (fire-and-forget). {@link #publish} returns immediately; neither the encoding nor
 * the upload runs on the caller's thread. Failures are logged and dropped.
 */
public class RestReceiptHandoffPublisher implements ReceiptHandoffPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestReceiptHandoffPublisher.class);

    static final String UPLOAD_PATH = "/api/v1/receipts";

    private final WebClient uploadClient;
    private final Scheduler encodeScheduler;

    public RestReceiptHandoffPublisher(WebClient uploadClient, Scheduler encodeScheduler) {
        this.uploadClient    = uploadClient;
        this.encodeScheduler = encodeScheduler;
    }

    @Override
    public void publish(AcceptedReceipt receipt) {
        String sessionId = receipt.sessionId();

        Mono.fromCallable(() -> PngCodec.encode(receipt.image()))
            .subscribeOn(encodeScheduler)
            .flatMap(png -> uploadClient.post()
                .uri(UPLOAD_PATH)
                .header("X-Session-Id", sessionId)
                .header("X-Frame-Count", String.valueOf(receipt.frameCount()))
                .header("X-Stitch-Fallback", String.valueOf(receipt.stitchFallback()))
                .contentType(MediaType.IMAGE_PNG)
                .bodyValue(png)
                .retrieve()
                .toBodilessEntity()
                .doOnNext(r -> SessionMdc.withMdc(sessionId, () ->
                    log.info("[Handoff] receipt published. bytes={} status={}", png.length, r.getStatusCode()))))
            .subscribe(
                r   -> {},
                err -> SessionMdc.withMdc(sessionId, () ->
                         log.warn("[Handoff] receipt publish failed (non-critical). reason={}", err.getMessage()))
            );
    }
}
