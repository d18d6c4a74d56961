package com.acme.events.core;

import com.acme.events.config.MessagingConfig;
import com.acme.events.spi.DeadLetterSink;
import com.acme.events.spi.MessageChannel;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class DeadLetterPublisher implements DeadLetterSink {
    private static final Logger LOG = LoggerFactory.getLogger(DeadLetterPublisher.class);

    private final MessageChannel channel;
    private final String subject;

    public DeadLetterPublisher(MessageChannel channel, MessagingConfig config) {
        this.channel = channel;
        this.subject = config.getSubjects().getDeadLetter();
    }

    @Override
    public void publish(DeadLetterRecord record) {
        try {
            channel.send(subject, record.payload(), record.toHeaders());
        } catch (RuntimeException e) {
            // Nothing else will pick this message up; an operator has to.
            LOG.error("ALARM: failed to publish dead-letter record to {} (reason={}, attempt_count={}, original_subject={})",
                subject, record.reason(), record.retry().attemptCount(), record.retry().originalSubject(), e);
            throw new DeadLetterPublishException("Failed to publish dead-letter record to " + subject, e);
        }
        LOG.warn("Dead-lettered message to {}: reason={}, attempt_count={}, last_error={}",
            subject, record.reason(), record.retry().attemptCount(), record.retry().lastError());
    }
}
