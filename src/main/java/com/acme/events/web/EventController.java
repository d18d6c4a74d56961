package com.acme.events.web;

import com.acme.events.core.EventIngestService;
import com.acme.events.core.InvalidBatchException;
import com.acme.events.core.Jsons;
import com.acme.events.core.PublishException;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Controller("/events")
public class EventController {
    private static final Logger LOG = LoggerFactory.getLogger(EventController.class);

    private final EventIngestService ingest;

    public EventController(EventIngestService ingest) {
        this.ingest = ingest;
    }

    /**
     * Accepts a batch and returns once it is on the broker. Processing happens later; its
     * failures never reach the caller.
     */
    @Post(consumes = MediaType.APPLICATION_JSON, produces = MediaType.APPLICATION_JSON)
    public HttpResponse<?> submit(@Body String payload) {
        try {
            int count = ingest.ingest(payload);
            return HttpResponse.accepted()
                .body(Jsons.toJson(new Accepted("accepted", "Events queued for processing", count)));
        } catch (InvalidBatchException e) {
            return HttpResponse.badRequest(Jsons.error(e.getMessage()));
        } catch (PublishException e) {
            LOG.error("Failed to publish ingested batch", e);
            return HttpResponse.status(HttpStatus.BAD_GATEWAY)
                .body(Jsons.error(e.getMessage()));
        }
    }

    record Accepted(String status, String message, @JsonProperty("events_count") int eventsCount) {}
}
