package com.scrollcapture.core.motion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MotionSamplerTest {

    private static MotionSample vertical(double y) {
        return new MotionSample(y, 0.0, 0.0, Instant.now());
    }

    /** Sensor whose samples are pushed by the test. */
    static final class PushedSensor implements MotionSensor {
        final Sinks.Many<MotionSample> sink = Sinks.many().multicast().directBestEffort();
        int subscriptions;

        @Override
        public Flux<MotionSample> samples() {
            return sink.asFlux().doOnSubscribe(s -> subscriptions++);
        }

        void push(MotionSample sample) {
            sink.tryEmitNext(sample);
        }

        int subscriberCount() {
            return sink.currentSubscriberCount();
        }
    }

    @Nested
    @DisplayName("moving average")
    class AverageTests {

        @Test
        @DisplayName("10 identical values x → velocity == x")
        void identicalValues() {
            MotionSampler sampler = new MotionSampler(new PushedSensor());
            for (int i = 0; i < 10; i++) {
                sampler.onSample(vertical(0.12));
            }
            assertEquals(0.12, sampler.current().velocity(), 1e-12);
            assertEquals(10, sampler.current().windowSize());
        }

        @Test
        @DisplayName("11th value evicts the oldest")
        void eviction() {
            MotionSampler sampler = new MotionSampler(new PushedSensor());
            sampler.onSample(vertical(1.0));
            for (int i = 0; i < 9; i++) {
                sampler.onSample(vertical(0.0));
            }
            assertEquals(0.1, sampler.current().velocity(), 1e-12);

            sampler.onSample(vertical(0.0));
            assertEquals(0.0, sampler.current().velocity(), 1e-12);
            assertEquals(10, sampler.current().windowSize());
        }

        @Test
        @DisplayName("partial window averages what it has")
        void partialWindow() {
            MotionSampler sampler = new MotionSampler(new PushedSensor());
            sampler.onSample(vertical(0.1));
            sampler.onSample(vertical(0.3));
            assertEquals(0.2, sampler.current().velocity(), 1e-12);
            assertEquals(2, sampler.current().windowSize());
        }

        @Test
        @DisplayName("movingDown once the average passes 0.05")
        void movingDown() {
            MotionSampler sampler = new MotionSampler(new PushedSensor());
            sampler.onSample(vertical(0.05));
            assertFalse(sampler.current().movingDown());
            sampler.onSample(vertical(0.2));
            assertTrue(sampler.current().movingDown());
        }
    }

    @Nested
    @DisplayName("stability")
    class StabilityTests {

        @Test
        @DisplayName("stable only when lateral and depth are both below 0.15")
        void thresholds() {
            MotionSampler sampler = new MotionSampler(new PushedSensor());

            sampler.onSample(new MotionSample(0.1, 0.14, -0.14, Instant.now()));
            assertTrue(sampler.current().stable());

            sampler.onSample(new MotionSample(0.1, 0.15, 0.0, Instant.now()));
            assertFalse(sampler.current().stable());

            sampler.onSample(new MotionSample(0.1, 0.0, -0.2, Instant.now()));
            assertFalse(sampler.current().stable());
        }

        @Test
        @DisplayName("computed from the current sample, not the history")
        void instantaneous() {
            MotionSampler sampler = new MotionSampler(new PushedSensor());
            for (int i = 0; i < 9; i++) {
                sampler.onSample(new MotionSample(0.1, 0.9, 0.9, Instant.now()));
            }
            assertFalse(sampler.current().stable());

            sampler.onSample(new MotionSample(0.1, 0.0, 0.0, Instant.now()));
            assertTrue(sampler.current().stable());
        }

        @Test
        @DisplayName("before any sample the device counts as stable and still")
        void initialState() {
            SmoothedMotion initial = new MotionSampler(new PushedSensor()).current();
            assertTrue(initial.stable());
            assertEquals(0.0, initial.velocity());
            assertFalse(initial.movingDown());
        }
    }

    @Nested
    @DisplayName("subscription lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("start() subscribes and samples flow into the window")
        void startSubscribes() {
            PushedSensor sensor = new PushedSensor();
            MotionSampler sampler = new MotionSampler(sensor);
            sampler.start();

            sensor.push(vertical(0.2));
            assertTrue(sampler.isRunning());
            assertEquals(0.2, sampler.current().velocity(), 1e-12);
        }

        @Test
        @DisplayName("stop() unsubscribes immediately; later samples are ignored")
        void stopUnsubscribes() {
            PushedSensor sensor = new PushedSensor();
            MotionSampler sampler = new MotionSampler(sensor);
            sampler.start();
            sensor.push(vertical(0.2));

            sampler.stop();
            assertFalse(sampler.isRunning());
            assertEquals(0, sensor.subscriberCount());

            sensor.push(vertical(5.0));
            assertEquals(0.2, sampler.current().velocity(), 1e-12);
        }

        @Test
        @DisplayName("stop() on empty history and twice in a row is safe")
        void stopIsIdempotent() {
            MotionSampler sampler = new MotionSampler(new PushedSensor());
            assertDoesNotThrow(sampler::stop);
            sampler.start();
            assertDoesNotThrow(sampler::stop);
            assertDoesNotThrow(sampler::stop);
        }

        @Test
        @DisplayName("start() twice keeps a single subscription and a fresh window")
        void restartReplacesSubscription() {
            PushedSensor sensor = new PushedSensor();
            MotionSampler sampler = new MotionSampler(sensor);
            sampler.start();
            sensor.push(vertical(1.0));

            sampler.start();
            assertEquals(1, sensor.subscriberCount());
            assertEquals(2, sensor.subscriptions);
            assertEquals(0, sampler.current().windowSize());

            sensor.push(vertical(0.1));
            assertEquals(0.1, sampler.current().velocity(), 1e-12);
        }
    }
}
