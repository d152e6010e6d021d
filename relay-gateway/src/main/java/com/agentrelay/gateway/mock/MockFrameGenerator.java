package com.agentrelay.gateway.mock;

import com.agentrelay.gateway.protocol.RelayCodec;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Publishes a fixture snapshot immediately on start and then every
 * {@code intervalMs} while running.
 */
@Slf4j
public class MockFrameGenerator {

    private final RelayCodec codec;
    private final ScheduledExecutorService scheduler;
    private final long intervalMs;
    private final Clock clock;
    private ScheduledFuture<?> task;

    public MockFrameGenerator(RelayCodec codec, ScheduledExecutorService scheduler, long intervalMs) {
        this(codec, scheduler, intervalMs, Clock.systemUTC());
    }

    public MockFrameGenerator(RelayCodec codec, ScheduledExecutorService scheduler, long intervalMs, Clock clock) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        }
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.intervalMs = intervalMs;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Encoded snapshot frame for the current time.
     */
    public String snapshot() {
        return codec.write(MockFixtures.snapshot(clock.instant()));
    }

    public synchronized void start(Consumer<String> sink) {
        Objects.requireNonNull(sink, "sink");
        if (task != null) {
            return;
        }
        task = scheduler.scheduleAtFixedRate(() -> {
            try {
                sink.accept(snapshot());
            } catch (RuntimeException e) {
                log.warn("mock: snapshot publish failed: {}", e.getMessage(), e);
            }
        }, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("mock: publishing snapshots every {}ms", intervalMs);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.debug("mock: stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null;
    }
}
