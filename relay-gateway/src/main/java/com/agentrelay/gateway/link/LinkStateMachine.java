package com.agentrelay.gateway.link;

import java.util.List;
import java.util.Set;

import static com.agentrelay.gateway.link.ConnectionState.*;

/**
 * Transition function of a reconnecting link:
 * {@code (status, event) -> (status', effects)}.
 * <p>
 * Pure; holds only its immutable policy so it can be exercised without a
 * socket, a clock or a scheduler. Events that make no sense in the current
 * state leave it unchanged and produce no effects.
 */
public final class LinkStateMachine {

    private final int maxAttempts;
    private final Set<Integer> terminalCloseCodes;

    /**
     * @param maxAttempts        retries allowed before giving up; 0 for no limit
     * @param terminalCloseCodes close codes that end the link instead of
     *                           scheduling a retry
     */
    public LinkStateMachine(int maxAttempts, Set<Integer> terminalCloseCodes) {
        this.maxAttempts = Math.max(0, maxAttempts);
        this.terminalCloseCodes = terminalCloseCodes != null ? Set.copyOf(terminalCloseCodes) : Set.of();
    }

    public LinkStateMachine() {
        this(0, Set.of());
    }

    /**
     * Result of applying one event.
     */
    public record Transition(LinkStatus status, List<LinkEffect> effects) {

        static Transition unchanged(LinkStatus status) {
            return new Transition(status, List.of());
        }
    }

    public Transition apply(LinkStatus current, LinkEvent event) {
        ConnectionState state = current.state();

        if (event instanceof LinkEvent.Stop) {
            return new Transition(LinkStatus.INITIAL,
                    List.of(LinkEffect.CANCEL_RETRY, LinkEffect.CLOSE_TRANSPORT));
        }

        if (event instanceof LinkEvent.Start) {
            if (state == DISCONNECTED) {
                return new Transition(new LinkStatus(CONNECTING, current.attempt()),
                        List.of(LinkEffect.OPEN_TRANSPORT));
            }
            return Transition.unchanged(current);
        }

        if (event instanceof LinkEvent.Resume) {
            if (state == DISCONNECTED || state == RECONNECTING) {
                return new Transition(new LinkStatus(CONNECTING, 0),
                        List.of(LinkEffect.CANCEL_RETRY, LinkEffect.OPEN_TRANSPORT));
            }
            return Transition.unchanged(current);
        }

        if (event instanceof LinkEvent.RetryDue) {
            if (state == RECONNECTING) {
                return new Transition(new LinkStatus(CONNECTING, current.attempt()),
                        List.of(LinkEffect.OPEN_TRANSPORT));
            }
            return Transition.unchanged(current);
        }

        if (event instanceof LinkEvent.Opened) {
            if (state == CONNECTING) {
                return new Transition(new LinkStatus(CONNECTED, 0), List.of());
            }
            return Transition.unchanged(current);
        }

        if (event instanceof LinkEvent.Failed) {
            if (state == CONNECTING || state == CONNECTED) {
                return fail(current, null);
            }
            return Transition.unchanged(current);
        }

        if (event instanceof LinkEvent.Closed closed) {
            if (state == CONNECTING || state == CONNECTED) {
                return fail(current, closed.code());
            }
            return Transition.unchanged(current);
        }

        return Transition.unchanged(current);
    }

    private Transition fail(LinkStatus current, Integer closeCode) {
        boolean terminal = closeCode != null && terminalCloseCodes.contains(closeCode);
        boolean exhausted = maxAttempts > 0 && current.attempt() >= maxAttempts;
        if (terminal || exhausted) {
            return new Transition(new LinkStatus(DISCONNECTED, current.attempt()),
                    List.of(LinkEffect.CLOSE_TRANSPORT));
        }
        return new Transition(new LinkStatus(RECONNECTING, current.attempt() + 1),
                List.of(LinkEffect.CLOSE_TRANSPORT, new LinkEffect.ScheduleRetry(current.attempt())));
    }
}
