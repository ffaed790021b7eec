package com.scrollcapture.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scrollcapture.core.camera.SingleSlotCamera;
import com.scrollcapture.core.capture.CaptureTimings;
import com.scrollcapture.core.capture.FrameBuffer;
import com.scrollcapture.core.handoff.ReceiptHandoffPublisher;
import com.scrollcapture.core.motion.MotionSampler;
import com.scrollcapture.core.session.CaptureSession;
import com.scrollcapture.core.stitch.BlendedOverlapCompositor;
import com.scrollcapture.core.stitch.FrameCompositor;
import com.scrollcapture.core.stitch.GapStackCompositor;
import com.scrollcapture.core.stitch.StitchConfig;
import com.scrollcapture.service.device.ReceiptReplayPhotoSource;
import com.scrollcapture.service.device.ScriptedMotionSensor;
import com.scrollcapture.service.preview.PreviewState;
import com.scrollcapture.service.publisher.RestReceiptHandoffPublisher;
import com.scrollcapture.service.session.CaptureService;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class CaptureConfig {

    private static final Logger log = LoggerFactory.getLogger(CaptureConfig.class);

    // ── stitching ─────────────────────────────────────────────────────────────
    @Value("${capture.stitch.mode:blend}")
    private String stitchMode;

    @Value("${capture.stitch.overlap-ratio:0.38}")
    private double overlapRatio;

    @Value("${capture.stitch.blend-strip-px:2}")
    private int blendStripPx;

    @Value("${capture.stitch.stack-gap-px:4}")
    private int stackGapPx;

    // ── timing ────────────────────────────────────────────────────────────────
    @Value("${capture.timing.tick-ms:500}")
    private long tickMs;

    @Value("${capture.timing.capture-timeout-ms:3000}")
    private long captureTimeoutMs;

    // ── simulated devices ─────────────────────────────────────────────────────
    @Value("${capture.replay.image-path:}")
    private String replayImagePath;

    @Value("${capture.replay.frame-width:750}")
    private int replayFrameWidth;

    @Value("${capture.replay.frame-height:1000}")
    private int replayFrameHeight;

    @Value("${capture.replay.latency-ms:150}")
    private long replayLatencyMs;

    @Value("${capture.motion.vertical:0.12}")
    private double motionVertical;

    @Value("${capture.motion.lateral:0.02}")
    private double motionLateral;

    @Value("${capture.motion.depth:0.01}")
    private double motionDepth;

    // ── downstream ────────────────────────────────────────────────────────────
    @Value("${services.upload.base-url:http://localhost:8090}")
    private String uploadUrl;

    @Value("${services.upload.timeout-seconds:15}")
    private long uploadTimeoutSeconds;

    @Bean
    public StitchConfig stitchConfig() {
        return new StitchConfig(overlapRatio, blendStripPx, stackGapPx);
    }

    @Bean
    public FrameCompositor frameCompositor(StitchConfig stitchConfig) {
        FrameCompositor compositor = switch (stitchMode.trim().toLowerCase()) {
            case "blend" -> new BlendedOverlapCompositor(stitchConfig);
            case "stack" -> new GapStackCompositor(stitchConfig);
            default -> throw new IllegalArgumentException(
                "capture.stitch.mode must be 'blend' or 'stack': " + stitchMode);
        };
        log.info("[CaptureConfig] compositor={} overlapRatio={}", compositor.getClass().getSimpleName(), overlapRatio);
        return compositor;
    }

    @Bean
    public CaptureTimings captureTimings() {
        return new CaptureTimings(Duration.ofMillis(tickMs), Duration.ofMillis(captureTimeoutMs));
    }

    @Bean
    public ReceiptReplayPhotoSource receiptReplayPhotoSource() {
        return new ReceiptReplayPhotoSource(
            loadReceipt(), replayFrameHeight, overlapRatio, Duration.ofMillis(replayLatencyMs));
    }

    @Bean
    public SingleSlotCamera camera(ReceiptReplayPhotoSource photoSource, CaptureTimings timings) {
        return new SingleSlotCamera(photoSource, timings.captureTimeout(), Schedulers.parallel());
    }

    @Bean
    public ScriptedMotionSensor motionSensor() {
        return new ScriptedMotionSensor(motionVertical, motionLateral, motionDepth, Schedulers.parallel());
    }

    @Bean
    public PreviewState previewState() {
        return new PreviewState();
    }

    @Bean
    public CaptureSession captureSession(ScriptedMotionSensor motionSensor,
                                         SingleSlotCamera camera,
                                         FrameCompositor frameCompositor,
                                         CaptureTimings timings,
                                         PreviewState previewState,
                                         ReceiptHandoffPublisher handoffPublisher) {
        CaptureSession session = new CaptureSession(
            new MotionSampler(motionSensor), camera, new FrameBuffer(), frameCompositor, timings,
            Schedulers.parallel(), Schedulers.boundedElastic(), previewState, handoffPublisher);
        session.setFeedbackListener(previewState);
        return session;
    }

    @Bean
    public CaptureService captureService(CaptureSession captureSession,
                                         PreviewState previewState,
                                         ReceiptReplayPhotoSource receiptReplayPhotoSource,
                                         ScriptedMotionSensor motionSensor) {
        return new CaptureService(captureSession, previewState, receiptReplayPhotoSource, motionSensor);
    }

    @Bean
    public WebClient uploadClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(Duration.ofSeconds(uploadTimeoutSeconds));

        return builder
            .baseUrl(uploadUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean
    public RestReceiptHandoffPublisher receiptHandoffPublisher(WebClient uploadClient) {
        return new RestReceiptHandoffPublisher(uploadClient, Schedulers.boundedElastic());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private BufferedImage loadReceipt() {
        if (replayImagePath == null || replayImagePath.isBlank()) {
            return ReceiptReplayPhotoSource.synthetic(replayFrameWidth, replayFrameHeight * 6);
        }
        try {
            return ReceiptReplayPhotoSource.load(Path.of(replayImagePath));
        } catch (IOException e) {
            log.warn("[CaptureConfig] receipt image unusable, using synthetic receipt. path={} reason={}",
                     replayImagePath, e.getMessage());
            return ReceiptReplayPhotoSource.synthetic(replayFrameWidth, replayFrameHeight * 6);
        }
    }
}
