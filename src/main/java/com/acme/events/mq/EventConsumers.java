package com.acme.events.mq;

import com.acme.events.config.MessagingConfig;
import com.acme.events.core.EventBatchProcessor;
import io.micronaut.context.annotation.Requires;
import io.micronaut.jms.annotations.JMSListener;
import io.micronaut.jms.annotations.Message;
import io.micronaut.jms.annotations.Queue;
import io.micronaut.messaging.annotation.MessageBody;

/**
 * Competing consumer on the working subject. Every instance with consumers enabled joins the same
 * group; the queue manager hands each message to one of them.
 *
 * <p>The listener session is transacted: returning normally commits the receive, and any exception
 * rolls it back so the broker redelivers the message.
 */
@Requires(property = "jms.consumers.enabled", value = "true", defaultValue = "false")
@JMSListener("mqConnectionFactory")
public class EventConsumers {
    private final EventBatchProcessor processor;

    public EventConsumers(EventBatchProcessor processor) {
        this.processor = processor;
    }

    @Queue(value = MessagingConfig.INGEST_SUBJECT, transacted = true)
    public void onEvents(@MessageBody String body, @Message jakarta.jms.Message m)
        throws jakarta.jms.JMSException {
        processor.process(Mappers.toEnvelope(body, m));
    }
}
