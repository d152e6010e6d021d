package com.agentrelay.gateway.link;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.agentrelay.gateway.link.ConnectionState.*;
import static org.junit.jupiter.api.Assertions.*;

class LinkStateMachineTest {

    private final LinkStateMachine unlimited = new LinkStateMachine();

    private static LinkStatus status(ConnectionState state, int attempt) {
        return new LinkStatus(state, attempt);
    }

    @Nested
    class Connecting {
        @Test
        void start_fromDisconnected_opensTransport() {
            var t = unlimited.apply(LinkStatus.INITIAL, LinkEvent.START);
            assertEquals(status(CONNECTING, 0), t.status());
            assertEquals(List.of(LinkEffect.OPEN_TRANSPORT), t.effects());
        }

        @Test
        void start_whileConnected_isIgnored() {
            var current = status(CONNECTED, 0);
            var t = unlimited.apply(current, LinkEvent.START);
            assertEquals(current, t.status());
            assertTrue(t.effects().isEmpty());
        }

        @Test
        void opened_resetsAttempt() {
            var t = unlimited.apply(status(CONNECTING, 4), LinkEvent.OPENED);
            assertEquals(status(CONNECTED, 0), t.status());
            assertTrue(t.effects().isEmpty());
        }

        @Test
        void opened_whenNotConnecting_isIgnored() {
            var t = unlimited.apply(LinkStatus.INITIAL, LinkEvent.OPENED);
            assertEquals(LinkStatus.INITIAL, t.status());
        }
    }

    @Nested
    class Failures {
        @Test
        void connectFailure_schedulesRetryForCurrentAttempt() {
            var t = unlimited.apply(status(CONNECTING, 2), new LinkEvent.Failed("refused"));
            assertEquals(status(RECONNECTING, 3), t.status());
            assertEquals(List.of(LinkEffect.CLOSE_TRANSPORT, new LinkEffect.ScheduleRetry(2)), t.effects());
        }

        @Test
        void closeWhileConnected_schedulesFirstRetry() {
            var t = unlimited.apply(status(CONNECTED, 0), new LinkEvent.Closed(1006, "abnormal"));
            assertEquals(status(RECONNECTING, 1), t.status());
            assertEquals(new LinkEffect.ScheduleRetry(0), t.effects().get(1));
        }

        @Test
        void retryDue_opensTransportKeepingAttempt() {
            var t = unlimited.apply(status(RECONNECTING, 3), LinkEvent.RETRY_DUE);
            assertEquals(status(CONNECTING, 3), t.status());
            assertEquals(List.of(LinkEffect.OPEN_TRANSPORT), t.effects());
        }

        @Test
        void retryDue_afterStop_isIgnored() {
            var t = unlimited.apply(LinkStatus.INITIAL, LinkEvent.RETRY_DUE);
            assertEquals(LinkStatus.INITIAL, t.status());
            assertTrue(t.effects().isEmpty());
        }

        @Test
        void maxAttemptsReached_givesUp() {
            var machine = new LinkStateMachine(3, Set.of());
            var t = machine.apply(status(CONNECTING, 3), new LinkEvent.Failed("refused"));
            assertEquals(status(DISCONNECTED, 3), t.status());
            assertEquals(List.of(LinkEffect.CLOSE_TRANSPORT), t.effects());
        }

        @Test
        void belowMaxAttempts_stillRetries() {
            var machine = new LinkStateMachine(3, Set.of());
            var t = machine.apply(status(CONNECTING, 2), new LinkEvent.Failed("refused"));
            assertEquals(RECONNECTING, t.status().state());
        }

        @Test
        void terminalCloseCode_givesUp() {
            var machine = new LinkStateMachine(0, Set.of(4404));
            var t = machine.apply(status(CONNECTED, 0), new LinkEvent.Closed(4404, "session not found"));
            assertEquals(DISCONNECTED, t.status().state());
            assertFalse(t.effects().stream().anyMatch(e -> e instanceof LinkEffect.ScheduleRetry));
        }

        @Test
        void failureWhileReconnecting_isIgnored() {
            var current = status(RECONNECTING, 2);
            var t = unlimited.apply(current, new LinkEvent.Failed("late"));
            assertEquals(current, t.status());
            assertTrue(t.effects().isEmpty());
        }
    }

    @Nested
    class StopAndResume {
        @Test
        void stop_fromAnyState_disconnects() {
            for (ConnectionState state : ConnectionState.values()) {
                var t = unlimited.apply(status(state, 2), LinkEvent.STOP);
                assertEquals(LinkStatus.INITIAL, t.status(), state.name());
                assertEquals(List.of(LinkEffect.CANCEL_RETRY, LinkEffect.CLOSE_TRANSPORT), t.effects());
            }
        }

        @Test
        void resume_whileReconnecting_reconnectsImmediately() {
            var t = unlimited.apply(status(RECONNECTING, 5), LinkEvent.RESUME);
            assertEquals(status(CONNECTING, 0), t.status());
            assertEquals(List.of(LinkEffect.CANCEL_RETRY, LinkEffect.OPEN_TRANSPORT), t.effects());
        }

        @Test
        void resume_afterGivingUp_reconnects() {
            var t = unlimited.apply(status(DISCONNECTED, 7), LinkEvent.RESUME);
            assertEquals(status(CONNECTING, 0), t.status());
        }

        @Test
        void resume_whileConnectingOrConnected_isNoOp() {
            for (ConnectionState state : List.of(CONNECTING, CONNECTED)) {
                var current = status(state, 1);
                var t = unlimited.apply(current, LinkEvent.RESUME);
                assertEquals(current, t.status());
                assertTrue(t.effects().isEmpty());
            }
        }
    }
}
