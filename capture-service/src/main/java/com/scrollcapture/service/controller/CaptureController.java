package com.scrollcapture.service.controller;

import com.scrollcapture.core.camera.FlashMode;
import com.scrollcapture.core.handoff.AcceptedReceipt;
import com.scrollcapture.core.session.CaptureOutcome;
import com.scrollcapture.core.session.CaptureStatus;
import com.scrollcapture.service.image.PngCodec;
import com.scrollcapture.service.preview.PreviewState;
import com.scrollcapture.service.session.CaptureService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * REST control surface for the hosted capture session.
 *
 * <p>Typical client flow:
 * <ol>
 *   <li>POST /start?flash=AUTO: begins capturing, frame 0 is taken immediately</li>
 *   <li>GET  /status: polls guidance, frame count and progress while scrolling</li>
 *   <li>POST /stop: ends the capture and returns the outcome summary</li>
 *   <li>GET  /result: the stitched image as PNG</li>
 *   <li>POST /accept: hands the image to the upload service, or POST /retake</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/capture")
public class CaptureController {

    private static final Logger log = LoggerFactory.getLogger(CaptureController.class);

    private final CaptureService captureService;
    private final Scheduler      encodeScheduler;

    @Autowired
    public CaptureController(CaptureService captureService) {
        this(captureService, Schedulers.boundedElastic());
    }

    public CaptureController(CaptureService captureService, Scheduler encodeScheduler) {
        this.captureService  = captureService;
        this.encodeScheduler = encodeScheduler;
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestParam(defaultValue = "AUTO") FlashMode flash) {
        log.info("[CaptureAPI] start. flash={}", flash);
        return ResponseEntity.ok(statusToMap(captureService.start(flash)));
    }

    /** Ends the capture; waits for stitching and returns the outcome summary. 409 when idle. */
    @PostMapping("/stop")
    public Mono<ResponseEntity<Map<String, Object>>> stop() {
        log.info("[CaptureAPI] stop requested");
        return captureService.stop()
            .map(outcome -> ResponseEntity.ok(outcomeToMap(outcome)))
            .onErrorResume(IllegalStateException.class, e -> {
                log.warn("[CaptureAPI] stop rejected. reason={}", e.getMessage());
                return Mono.just(ResponseEntity.<Map<String, Object>>status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage())));
            });
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(statusToMap(captureService.status()));
    }

    /** The READY image as PNG, encoded off the request thread; 404 when there is none. */
    @GetMapping(value = "/result", produces = MediaType.IMAGE_PNG_VALUE)
    public Mono<ResponseEntity<byte[]>> result() {
        return Mono.justOrEmpty(captureService.readyOutcome())
            .flatMap(outcome -> Mono.fromCallable(() -> PngCodec.encode(outcome.image()))
                .subscribeOn(encodeScheduler)
                .map(png -> ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .header("X-Frame-Count", String.valueOf(outcome.frameCount()))
                    .header("X-Stitch-Fallback", String.valueOf(outcome.fallback()))
                    .body(png)))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/retake")
    public ResponseEntity<Map<String, Object>> retake() {
        log.info("[CaptureAPI] retake");
        return ResponseEntity.ok(statusToMap(captureService.retake()));
    }

    /** 202 once the image is handed to the upload service; 409 when nothing is ready. */
    @PostMapping("/accept")
    public ResponseEntity<Map<String, Object>> accept() {
        try {
            AcceptedReceipt receipt = captureService.accept();
            log.info("[CaptureAPI] accepted. sessionId={}", receipt.sessionId());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "sessionId",  receipt.sessionId(),
                "frameCount", receipt.frameCount(),
                "fallback",   receipt.stitchFallback(),
                "acceptedAt", receipt.acceptedAt()
            ));
        } catch (IllegalStateException e) {
            log.warn("[CaptureAPI] accept rejected. reason={}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        log.info("[CaptureAPI] cancel");
        captureService.cancel();
        return ResponseEntity.ok(statusToMap(captureService.status()));
    }

    /** Changes the simulated hand motion; samples after this call use the new values. */
    @PostMapping("/motion")
    public ResponseEntity<Void> motion(@RequestParam double vertical,
                                       @RequestParam(defaultValue = "0") double lateral,
                                       @RequestParam(defaultValue = "0") double depth) {
        log.info("[CaptureAPI] motion profile. vertical={} lateral={} depth={}", vertical, lateral, depth);
        captureService.updateMotion(vertical, lateral, depth);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Map<String, Object> statusToMap(CaptureStatus s) {
        PreviewState preview = captureService.getPreview();
        return Map.of(
            "sessionId",       s.sessionId() != null ? s.sessionId() : "",
            "state",           s.state().name(),
            "frameCount",      s.frameCount(),
            "progressPct",     Math.round(s.progress() * 1000.0) / 10.0,
            "speed",           s.speed().name(),
            "guidance",        preview.getGuidance(),
            "velocity",        Math.round(s.motion().velocity() * 1000.0) / 1000.0,
            "stable",          s.motion().stable(),
            "movingDown",      s.motion().movingDown(),
            "captureInFlight", s.captureInFlight()
        );
    }

    private Map<String, Object> outcomeToMap(CaptureOutcome o) {
        return Map.of(
            "sessionId",   o.sessionId() != null ? o.sessionId() : "",
            "status",      o.status().name(),
            "frameCount",  o.frameCount(),
            "fallback",    o.fallback(),
            "imageWidth",  o.image() != null ? o.image().getWidth() : 0,
            "imageHeight", o.image() != null ? o.image().getHeight() : 0
        );
    }
}
