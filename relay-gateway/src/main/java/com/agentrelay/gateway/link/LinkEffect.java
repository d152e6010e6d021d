package com.agentrelay.gateway.link;

/**
 * Side effects requested by a transition; executed by {@link ReconnectingLink}.
 */
public sealed interface LinkEffect {

    record OpenTransport() implements LinkEffect {
    }

    record CloseTransport() implements LinkEffect {
    }

    /**
     * Arm the retry timer.
     *
     * @param attempt 0-based attempt index used for the backoff delay
     */
    record ScheduleRetry(int attempt) implements LinkEffect {
    }

    record CancelRetry() implements LinkEffect {
    }

    LinkEffect OPEN_TRANSPORT = new OpenTransport();
    LinkEffect CLOSE_TRANSPORT = new CloseTransport();
    LinkEffect CANCEL_RETRY = new CancelRetry();
}
