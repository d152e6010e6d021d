package com.agentrelay.gateway.link;

import com.agentrelay.common.infra.Backoff;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * One logical connection that re-establishes itself with exponential backoff.
 * <p>
 * Transitions come from {@link LinkStateMachine}; this class executes the
 * effects: opening transports through the caller's {@link TransportFactory},
 * arming and cancelling the retry timer, closing superseded transports.
 * <p>
 * Every transport attempt and every {@link #stop()} bumps a generation
 * counter. Connect completions, transport callbacks and retry timers carry the
 * generation they were issued under and are discarded once it is stale, so a
 * late connect can never revive a stopped link. No lock is held while a
 * transport is being opened.
 */
@Slf4j
public class ReconnectingLink {

    /**
     * Link tuning.
     */
    @Getter
    @Builder
    public static class Options {
        @Builder.Default
        private final String name = "link";
        @Builder.Default
        private final Backoff.Policy policy = Backoff.Policy.STANDARD;
        /** 0 retries forever. */
        @Builder.Default
        private final int maxAttempts = 0;
        @Builder.Default
        private final Set<Integer> terminalCloseCodes = Set.of();
        /** Uniform samples in [0, 1] used for jitter. */
        @Builder.Default
        private final DoubleSupplier jitter = () -> ThreadLocalRandom.current().nextDouble();
    }

    private final Options options;
    private final TransportFactory factory;
    private final ScheduledExecutorService scheduler;
    private final LinkListener listener;
    private final LinkStateMachine machine;

    private final Object lock = new Object();
    private LinkStatus status = LinkStatus.INITIAL;
    private long generation;
    private FrameTransport transport;
    private ScheduledFuture<?> retryTask;
    private long scheduledRetryAt;

    public ReconnectingLink(Options options, TransportFactory factory,
            ScheduledExecutorService scheduler, LinkListener listener) {
        this.options = Objects.requireNonNull(options, "options");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.listener = listener != null ? listener : LinkListener.NONE;
        this.machine = new LinkStateMachine(options.getMaxAttempts(), options.getTerminalCloseCodes());
    }

    // --- Lifecycle ---

    /**
     * Begin connecting. No-op unless {@code DISCONNECTED}.
     */
    public void start() {
        dispatch(LinkEvent.START, null, null);
    }

    /**
     * Cancel any pending retry, close the transport and move to
     * {@code DISCONNECTED}. Safe from any state and from any thread, including
     * while a connect is in flight.
     */
    public void stop() {
        dispatch(LinkEvent.STOP, null, null);
    }

    /**
     * Reconnect now with a fresh attempt count, skipping the backoff delay.
     * No-op while {@code CONNECTING} or {@code CONNECTED}.
     */
    public void resume() {
        dispatch(LinkEvent.RESUME, null, null);
    }

    // --- I/O ---

    /**
     * Send a frame on the live transport.
     *
     * @return {@code false} if the link is not connected or the send failed
     */
    public boolean send(String frame) {
        FrameTransport current;
        synchronized (lock) {
            if (status.state() != ConnectionState.CONNECTED || transport == null) {
                return false;
            }
            current = transport;
        }
        try {
            current.send(frame);
            return true;
        } catch (IOException e) {
            log.warn("link:{} send failed: {}", options.getName(), e.getMessage());
            return false;
        }
    }

    // --- Observation ---

    public ConnectionState getState() {
        synchronized (lock) {
            return status.state();
        }
    }

    public int getAttempt() {
        synchronized (lock) {
            return status.attempt();
        }
    }

    public LinkStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public boolean isConnected() {
        return getState() == ConnectionState.CONNECTED;
    }

    /**
     * Epoch millis of the pending retry, present only while {@code RECONNECTING}.
     */
    public OptionalLong getScheduledRetryAt() {
        synchronized (lock) {
            return retryTask != null ? OptionalLong.of(scheduledRetryAt) : OptionalLong.empty();
        }
    }

    public String getName() {
        return options.getName();
    }

    // --- Internals ---

    /**
     * Apply an event under the lock, then run the resulting side effects and
     * notifications outside it.
     *
     * @param eventGeneration generation the event belongs to, or {@code null}
     *                        for caller-driven events
     * @param opened          transport delivered with an {@code Opened} event
     */
    private void dispatch(LinkEvent event, Long eventGeneration, FrameTransport opened) {
        List<Runnable> actions = new ArrayList<>();
        LinkStatus before;
        LinkStatus after;

        synchronized (lock) {
            if (eventGeneration != null && eventGeneration != generation) {
                if (opened != null) {
                    actions.add(opened::close);
                }
                log.debug("link:{} ignoring stale {} (gen {} != {})",
                        options.getName(), event, eventGeneration, generation);
                runAll(actions);
                return;
            }

            before = status;
            LinkStateMachine.Transition transition = machine.apply(status, event);
            status = transition.status();

            if (opened != null) {
                if (status.state() == ConnectionState.CONNECTED && before.state() == ConnectionState.CONNECTING) {
                    transport = opened;
                } else {
                    actions.add(opened::close);
                }
            }
            if (event instanceof LinkEvent.Stop) {
                generation++;
            }
            if (event instanceof LinkEvent.RetryDue && status.state() == ConnectionState.CONNECTING) {
                retryTask = null;
            }

            for (LinkEffect effect : transition.effects()) {
                applyEffect(effect, actions);
            }
            after = status;
        }

        if (before.state() != after.state()) {
            logTransition(before, after, event);
            listener.onStateChange(before.state(), after.state());
        }
        runAll(actions);
    }

    // Called with the lock held.
    private void applyEffect(LinkEffect effect, List<Runnable> actions) {
        if (effect instanceof LinkEffect.OpenTransport) {
            long gen = ++generation;
            actions.add(() -> openTransport(gen));
        } else if (effect instanceof LinkEffect.CloseTransport) {
            FrameTransport old = transport;
            transport = null;
            if (old != null) {
                actions.add(old::close);
            }
        } else if (effect instanceof LinkEffect.ScheduleRetry retry) {
            cancelRetry();
            long delay = Backoff.compute(options.getPolicy(), retry.attempt(), options.getJitter().getAsDouble());
            long gen = generation;
            try {
                retryTask = scheduler.schedule(() -> dispatch(LinkEvent.RETRY_DUE, gen, null),
                        delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                // No scheduler left to fire the retry.
                status = new LinkStatus(ConnectionState.DISCONNECTED, status.attempt());
                generation++;
                actions.add(() -> log.error("link:{} retry rejected by scheduler, link parked: {}",
                        options.getName(), e.getMessage()));
                return;
            }
            scheduledRetryAt = System.currentTimeMillis() + delay;
            int attempt = retry.attempt();
            actions.add(() -> {
                log.info("link:{} reconnecting in {}ms (attempt {})", options.getName(), delay, attempt + 1);
                listener.onRetryScheduled(attempt, delay);
            });
        } else if (effect instanceof LinkEffect.CancelRetry) {
            cancelRetry();
        }
    }

    private void cancelRetry() {
        if (retryTask != null) {
            retryTask.cancel(false);
            retryTask = null;
        }
        scheduledRetryAt = 0;
    }

    private void openTransport(long gen) {
        CompletableFuture<FrameTransport> future;
        try {
            future = factory.open(new GenerationListener(gen));
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.failedFuture(new IllegalStateException("transport factory returned null"));
        }
        future.whenComplete((opened, error) -> {
            if (error != null) {
                log.warn("link:{} connect failed: {}", options.getName(), describe(error));
                dispatch(new LinkEvent.Failed(describe(error)), gen, null);
            } else {
                dispatch(LinkEvent.OPENED, gen, opened);
            }
        });
    }

    private boolean isCurrent(long gen) {
        synchronized (lock) {
            return gen == generation;
        }
    }

    private void logTransition(LinkStatus before, LinkStatus after, LinkEvent event) {
        if (after.state() == ConnectionState.CONNECTED) {
            log.info("link:{} connected", options.getName());
        } else if (after.state() == ConnectionState.DISCONNECTED && !(event instanceof LinkEvent.Stop)) {
            log.warn("link:{} giving up after {} attempt(s) ({})", options.getName(), after.attempt(), event);
        } else {
            log.debug("link:{} {} -> {} attempt={}", options.getName(), before.state(), after.state(),
                    after.attempt());
        }
    }

    private static void runAll(List<Runnable> actions) {
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("link action failed: {}", e.getMessage(), e);
            }
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause != cause.getCause()) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Routes transport callbacks tagged with the generation that opened them.
     */
    private final class GenerationListener implements TransportListener {

        private final long gen;

        GenerationListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onMessage(String frame) {
            if (isCurrent(gen)) {
                listener.onFrame(frame);
            }
        }

        @Override
        public void onClosed(int code, String reason) {
            dispatch(new LinkEvent.Closed(code, reason), gen, null);
        }

        @Override
        public void onError(Throwable error) {
            dispatch(new LinkEvent.Failed(describe(error)), gen, null);
        }
    }
}
