package com.scrollcapture.service.publisher;

import com.scrollcapture.core.handoff.AcceptedReceipt;
import com.scrollcapture.core.stitch.FrameImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.awt.Color;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RestReceiptHandoffPublisherTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger encodeTasks = new AtomicInteger();

    // runs inline so requests are visible right after publish(), but counts the hand-off
    private final Scheduler encodeScheduler = Schedulers.fromExecutor(task -> {
        encodeTasks.incrementAndGet();
        task.run();
    });

    private RestReceiptHandoffPublisher publisherAnswering(HttpStatus status) {
        WebClient client = WebClient.builder()
            .baseUrl("http://upload.test")
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(status).build());
            })
            .build();
        return new RestReceiptHandoffPublisher(client, encodeScheduler);
    }

    private static AcceptedReceipt receipt() {
        return new AcceptedReceipt("session-1", FrameImages.opaqueCanvas(10, 30, Color.WHITE),
                                   5, false, Instant.now());
    }

    @Test
    @DisplayName("POSTs the PNG to the upload service with session headers")
    void publishes() {
        publisherAnswering(HttpStatus.CREATED).publish(receipt());

        assertEquals(1, requests.size());
        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("http://upload.test" + RestReceiptHandoffPublisher.UPLOAD_PATH, request.url().toString());
        assertEquals(MediaType.IMAGE_PNG, request.headers().getContentType());
        assertEquals("session-1", request.headers().getFirst("X-Session-Id"));
        assertEquals("5", request.headers().getFirst("X-Frame-Count"));
        assertEquals("false", request.headers().getFirst("X-Stitch-Fallback"));
    }

    @Test
    @DisplayName("PNG encoding runs on the encode scheduler, not the caller")
    void encodesOffCaller() {
        publisherAnswering(HttpStatus.OK).publish(receipt());

        assertTrue(encodeTasks.get() > 0);
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("upload failure is absorbed, never thrown to the caller")
    void failureAbsorbed() {
        RestReceiptHandoffPublisher publisher = publisherAnswering(HttpStatus.SERVICE_UNAVAILABLE);
        assertDoesNotThrow(() -> publisher.publish(receipt()));
        assertEquals(1, requests.size());
    }
}
