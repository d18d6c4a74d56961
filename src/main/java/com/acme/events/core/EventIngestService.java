package com.acme.events.core;

import com.acme.events.config.MessagingConfig;
import com.acme.events.spi.MessageChannel;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates an ingested batch and publishes it to the working subject in broker-sized chunks.
 */
@Singleton
public class EventIngestService {
    private static final Logger LOG = LoggerFactory.getLogger(EventIngestService.class);

    private final MessageChannel channel;
    private final String subject;
    private final int maxEventsPerRequest;
    private final int maxEventsPerMessage;
    private final int maxMessageBytes;

    public EventIngestService(MessageChannel channel, MessagingConfig config) {
        this.channel = channel;
        this.subject = config.getSubjects().getIngest();
        this.maxEventsPerRequest = config.getMaxEventsPerRequest();
        this.maxEventsPerMessage = config.getMaxEventsPerMessage();
        this.maxMessageBytes = config.getMaxMessageBytes();
    }

    /**
     * @return number of events accepted
     * @throws InvalidBatchException if the body is not a valid batch
     * @throws PublishException if the broker rejects a chunk
     */
    public int ingest(String body) {
        List<Event> events;
        try {
            events = EventBatchCodec.decode(body);
        } catch (MalformedMessageException e) {
            throw new InvalidBatchException(e.getMessage(), e);
        }
        if (events.size() > maxEventsPerRequest) {
            throw new InvalidBatchException("Batch size exceeds maximum of " + maxEventsPerRequest + " events");
        }

        // Serialize everything before the first send so an oversize event rejects the whole request.
        var chunks = new ArrayList<String>();
        for (int from = 0; from < events.size(); from += maxEventsPerMessage) {
            split(events.subList(from, Math.min(events.size(), from + maxEventsPerMessage)), chunks);
        }

        var headers = RetryEnvelope.initial(subject).toHeaders();
        for (String chunk : chunks) {
            try {
                channel.send(subject, chunk, headers);
            } catch (RuntimeException e) {
                throw new PublishException("Broker publish failed: " + e.getMessage(), e);
            }
        }
        LOG.info("Published {} events to {} in {} messages", events.size(), subject, chunks.size());
        return events.size();
    }

    private void split(List<Event> events, List<String> out) {
        String body = EventBatchCodec.encode(events);
        if (EventBatchCodec.encodedSize(body) <= maxMessageBytes) {
            out.add(body);
            return;
        }
        if (events.size() == 1) {
            throw new InvalidBatchException("Event " + events.get(0).eventId()
                + " exceeds the maximum message size of " + maxMessageBytes + " bytes");
        }
        int mid = events.size() / 2;
        split(events.subList(0, mid), out);
        split(events.subList(mid, events.size()), out);
    }
}
