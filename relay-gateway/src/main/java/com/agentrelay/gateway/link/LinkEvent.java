package com.agentrelay.gateway.link;

/**
 * Inputs of the link state machine.
 */
public sealed interface LinkEvent {

    /** Caller asked the link to connect. */
    record Start() implements LinkEvent {
    }

    /** Caller abandoned the link. */
    record Stop() implements LinkEvent {
    }

    /** Out-of-band reconnect request, e.g. a background tab became visible. */
    record Resume() implements LinkEvent {
    }

    /** Transport established. */
    record Opened() implements LinkEvent {
    }

    /** Establishment failed or the live transport errored. */
    record Failed(String reason) implements LinkEvent {
    }

    /** Transport closed by the peer or the network. */
    record Closed(int code, String reason) implements LinkEvent {
    }

    /** Backoff delay elapsed. */
    record RetryDue() implements LinkEvent {
    }

    LinkEvent START = new Start();
    LinkEvent STOP = new Stop();
    LinkEvent RESUME = new Resume();
    LinkEvent OPENED = new Opened();
    LinkEvent RETRY_DUE = new RetryDue();
}
