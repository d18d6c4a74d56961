package com.acme.events.mq;

import jakarta.jms.Queue;
import jakarta.jms.TextMessage;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MappersTest {

    @Test
    void testToEnvelopeKeepsApplicationProperties() throws Exception {
        var m = mock(TextMessage.class);
        var dest = mock(Queue.class);
        when(dest.toString()).thenReturn("queue:///events.ingest");
        when(m.getJMSDestination()).thenReturn(dest);
        when(m.getJMSMessageID()).thenReturn("ID:414d51");
        when(m.getPropertyNames()).thenReturn(Collections.enumeration(
            List.of("attempt_count", "original_subject", "JMSXDeliveryCount", "JMS_IBM_Format")));
        when(m.getStringProperty("attempt_count")).thenReturn("2");
        when(m.getStringProperty("original_subject")).thenReturn("events.ingest");

        var env = Mappers.toEnvelope("{\"events\":[]}", m);

        assertEquals("ID:414d51", env.messageId());
        assertEquals("events.ingest", env.subject());
        assertEquals("{\"events\":[]}", env.payload());
        assertEquals(2, env.headers().size());
        assertEquals("2", env.headers().get("attempt_count"));
        verify(m, never()).getStringProperty("JMSXDeliveryCount");
    }

    @Test
    void testQueueName() {
        assertEquals("events.dlq", Mappers.queueName("queue:///events.dlq"));
        assertEquals("events.ingest", Mappers.queueName("queue:///events.ingest?targetClient=1"));
        assertEquals("events.ingest", Mappers.queueName("events.ingest"));
        assertNull(Mappers.queueName(""));
    }

    @Test
    void testProviderProperties() {
        assertTrue(Mappers.isProviderProperty("JMS_IBM_Format"));
        assertTrue(Mappers.isProviderProperty("JMSXDeliveryCount"));
        assertFalse(Mappers.isProviderProperty("attempt_count"));
    }
}
