package com.acme.events.mq;

import com.acme.events.core.BackoffPolicy;
import com.acme.events.core.DeadLetterPublishException;
import com.acme.events.core.EventBatchProcessor;
import com.acme.events.core.IdempotencyGate;
import com.acme.events.core.RetryEnvelope;
import com.acme.events.core.RetryPublishException;
import com.acme.events.core.TransientException;
import com.acme.events.spi.DeadLetterSink;
import com.acme.events.spi.EventStore;
import com.acme.events.test.InMemoryEventStore;
import com.acme.events.test.MockMessageChannel;
import com.acme.events.test.TestEvents;
import jakarta.jms.JMSException;
import jakarta.jms.Queue;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Drives the listener the way a transacted JMS listener session does: commit when the listener
 * returns, roll back when it throws.
 */
class EventConsumersTest {

    private static final String INGEST = "events.ingest";

    private InMemoryEventStore store;
    private MockMessageChannel channel;
    private DeadLetterSink deadLetters;
    private Session session;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        channel = new MockMessageChannel();
        deadLetters = mock(DeadLetterSink.class);
        session = mock(Session.class);
    }

    private EventConsumers consumers(EventStore s) {
        var processor = new EventBatchProcessor(new IdempotencyGate(s), deadLetters, channel,
            new BackoffPolicy(5, Duration.ofSeconds(1)), 5, INGEST, "worker-1");
        return new EventConsumers(processor);
    }

    private void deliver(EventConsumers consumers, TextMessage m) throws JMSException {
        try {
            consumers.onEvents(m.getText(), m);
            session.commit();
        } catch (RuntimeException e) {
            session.rollback();
            throw e;
        }
    }

    private static TextMessage message(String body, Map<String, String> headers) throws JMSException {
        var m = mock(TextMessage.class);
        var dest = mock(Queue.class);
        when(dest.toString()).thenReturn("queue:///" + INGEST);
        when(m.getText()).thenReturn(body);
        when(m.getJMSDestination()).thenReturn(dest);
        when(m.getJMSMessageID()).thenReturn("ID:414d5120");
        when(m.getPropertyNames()).thenReturn(Collections.enumeration(List.copyOf(headers.keySet())));
        for (var e : headers.entrySet()) {
            when(m.getStringProperty(e.getKey())).thenReturn(e.getValue());
        }
        return m;
    }

    @Test
    void testStoredBatchIsCommitted() throws Exception {
        var m = message(TestEvents.batch(TestEvents.event(1, "login"), TestEvents.event(2, "view")),
            RetryEnvelope.initial(INGEST).toHeaders());

        deliver(consumers(store), m);

        assertEquals(2, store.size());
        verify(session).commit();
        verify(session, never()).rollback();
    }

    @Test
    void testRedeliveredBatchIsCommittedWithoutNewRows() throws Exception {
        var consumers = consumers(store);
        String body = TestEvents.batch(TestEvents.event(1, "login"));

        deliver(consumers, message(body, RetryEnvelope.initial(INGEST).toHeaders()));
        deliver(consumers, message(body, RetryEnvelope.initial(INGEST).toHeaders()));

        assertEquals(1, store.size());
        verify(session, times(2)).commit();
        verify(session, never()).rollback();
    }

    @Test
    void testScheduledRetryIsCommitted() throws Exception {
        var failing = mock(EventStore.class);
        when(failing.insertIfAbsent(anyList())).thenThrow(new TransientException("db down"));

        deliver(consumers(failing), message(TestEvents.batch(TestEvents.event(1, "login")), Map.of()));

        assertEquals(1, channel.sentTo(INGEST).size());
        assertEquals("1", channel.sentTo(INGEST).get(0).headers().get(RetryEnvelope.ATTEMPT_COUNT));
        verify(session).commit();
        verify(session, never()).rollback();
    }

    @Test
    void testFailedRetryPublishRollsBack() throws Exception {
        var failing = mock(EventStore.class);
        when(failing.insertIfAbsent(anyList())).thenThrow(new TransientException("db down"));
        channel.failWith(new IllegalStateException("queue manager unavailable"));
        var consumers = consumers(failing);
        var m = message(TestEvents.batch(TestEvents.event(1, "login")), Map.of());

        assertThrows(RetryPublishException.class, () -> deliver(consumers, m));

        verify(session).rollback();
        verify(session, never()).commit();
    }

    @Test
    void testFailedDeadLetterPublishRollsBack() throws Exception {
        doThrow(new DeadLetterPublishException("dlq down", new IllegalStateException("down")))
            .when(deadLetters).publish(any());
        var consumers = consumers(store);
        var m = message("{\"events\":\"nope\"}", Map.of());

        assertThrows(DeadLetterPublishException.class, () -> deliver(consumers, m));

        verify(session).rollback();
        verify(session, never()).commit();
        assertEquals(0, store.size());
    }

    @Test
    void testDeadLetteredMessageIsCommitted() throws Exception {
        deliver(consumers(store), message("not json", Map.of()));

        verify(deadLetters).publish(any());
        verify(session).commit();
    }
}
