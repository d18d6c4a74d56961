package com.acme.events.core;

import com.acme.events.config.MessagingConfig;
import com.acme.events.config.RetryConfig;
import com.acme.events.spi.DeadLetterSink;
import com.acme.events.spi.MessageChannel;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one delivery from the working subject. Returning normally means the message may be
 * acknowledged: the batch is stored, a retry is on the broker, or a dead-letter record is.
 * Any exception leaves the message unacknowledged.
 */
@Singleton
public class EventBatchProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(EventBatchProcessor.class);

    private final IdempotencyGate gate;
    private final DeadLetterSink deadLetters;
    private final MessageChannel channel;
    private final BackoffPolicy backoff;
    private final int budget;
    private final String workingSubject;
    private final String workerId;

    @Inject
    public EventBatchProcessor(IdempotencyGate gate, DeadLetterSink deadLetters, MessageChannel channel,
                               BackoffPolicy backoff, RetryConfig retryConfig, MessagingConfig messagingConfig) {
        this(gate, deadLetters, channel, backoff, retryConfig.getBudget(),
            messagingConfig.getSubjects().getIngest(), host());
    }

    public EventBatchProcessor(IdempotencyGate gate, DeadLetterSink deadLetters, MessageChannel channel,
                               BackoffPolicy backoff, int budget, String workingSubject, String workerId) {
        if (budget < 0) {
            throw new IllegalArgumentException("Retry budget must be >= 0");
        }
        this.gate = gate;
        this.deadLetters = deadLetters;
        this.channel = channel;
        this.backoff = backoff;
        this.budget = budget;
        this.workingSubject = workingSubject;
        this.workerId = workerId;
    }

    public ProcessingOutcome process(Envelope env) {
        RetryEnvelope retry;
        List<Event> events;
        try {
            retry = pin(env, RetryEnvelope.fromHeaders(env.headers(), workingSubject));
            events = EventBatchCodec.decode(env.payload());
        } catch (MalformedMessageException e) {
            var parked = pin(env, RetryEnvelope.bestEffort(env.headers(), workingSubject)).withError(describe(e));
            LOG.warn("Malformed message {}: {}", env.messageId(), e.getMessage());
            deadLetters.publish(new DeadLetterRecord(env.payload(), parked,
                DeadLetterRecord.Reason.MALFORMED, Instant.now(), workerId));
            return ProcessingOutcome.DEAD_LETTERED;
        }

        IdempotencyGate.GateResult result;
        try {
            result = gate.apply(events);
        } catch (RuntimeException e) {
            return onPersistenceFailure(env, retry, e);
        }

        if (result.allDuplicates()) {
            LOG.info("Message {}: all {} events already stored", env.messageId(), result.duplicates().size());
            return ProcessingOutcome.DUPLICATE;
        }
        LOG.info("Message {}: stored {} events, skipped {} duplicates (attempt_count={})",
            env.messageId(), result.applied().size(), result.duplicates().size(), retry.attemptCount());
        return ProcessingOutcome.PERSISTED;
    }

    private ProcessingOutcome onPersistenceFailure(Envelope env, RetryEnvelope retry, RuntimeException failure) {
        String error = describe(failure);
        if (retry.exhausted(budget)) {
            LOG.warn("Message {}: retry budget {} exhausted at attempt_count={}", env.messageId(), budget, retry.attemptCount());
            deadLetters.publish(new DeadLetterRecord(env.payload(), retry.withError(error),
                DeadLetterRecord.Reason.RETRIES_EXHAUSTED, Instant.now(), workerId));
            return ProcessingOutcome.DEAD_LETTERED;
        }

        var next = retry.nextAttempt(error);
        Duration delay = backoff.delay(next.attemptCount());
        try {
            channel.send(next.originalSubject(), env.payload(), next.toHeaders(), delay);
        } catch (RuntimeException e) {
            throw new RetryPublishException("Failed to republish message " + env.messageId()
                + " to " + next.originalSubject(), e);
        }
        LOG.warn("Message {}: persistence failed ({}), retry {} of {} scheduled in {}",
            env.messageId(), error, next.attemptCount(), budget, delay);
        return ProcessingOutcome.RETRY_SCHEDULED;
    }

    private RetryEnvelope pin(Envelope env, RetryEnvelope retry) {
        if (!workingSubject.equals(retry.originalSubject())) {
            LOG.warn("Message {}: ignoring {}={}, retries go to {}", env.messageId(),
                RetryEnvelope.ORIGINAL_SUBJECT, retry.originalSubject(), workingSubject);
        }
        return retry.pinnedTo(workingSubject);
    }

    public String workerId() {
        return workerId;
    }

    static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + msg;
    }

    private static String host() {
        return System.getenv().getOrDefault("HOSTNAME", "worker") + "-" + ProcessHandle.current().pid();
    }
}
