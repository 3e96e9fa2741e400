package com.sessiongate.outbound;

import com.sessiongate.shared.config.OutboundConfig;
import com.sessiongate.shared.error.SessionNotConnectedException;
import com.sessiongate.shared.error.SessionNotFoundException;
import com.sessiongate.shared.model.SessionOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutboundMessageQueueTest {

    private final OutboundMessageQueue outbound = new OutboundMessageQueue(OutboundConfig.defaults());

    @Test
    void unknownSessionIsNotFound() {
        assertThrows(SessionNotFoundException.class, () -> outbound.enqueue("nobody", "peer", "hi", null));
        assertTrue(outbound.queue("nobody").isEmpty());
        assertEquals(0, outbound.pending("nobody"));
    }

    @Test
    void bufferingFollowsSessionOptions() {
        outbound.open("strict", SessionOptions.defaults());
        outbound.open("lenient", new SessionOptions(true, Map.of()));

        assertThrows(SessionNotConnectedException.class, () -> outbound.enqueue("strict", "peer", "hi", null));
        outbound.enqueue("lenient", "peer", "hi", null);
        assertEquals(1, outbound.pending("lenient"));
    }

    @Test
    void reopeningReplacesAndClosesPreviousQueue() {
        var first = outbound.open("s1", new SessionOptions(true, Map.of()));
        var receipt = outbound.enqueue("s1", "peer", "hi", null);

        var second = outbound.open("s1", new SessionOptions(true, Map.of()));

        assertNotSame(first, second);
        assertTrue(first.isClosed());
        assertTrue(receipt.isCompletedExceptionally());
        assertSame(second, outbound.queue("s1").orElseThrow());
        assertEquals(0, outbound.pending("s1"));
    }
}
