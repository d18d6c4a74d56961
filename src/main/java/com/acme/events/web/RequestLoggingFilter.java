package com.acme.events.web;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Filter;
import io.micronaut.http.filter.HttpServerFilter;
import io.micronaut.http.filter.ServerFilterChain;
import io.micronaut.http.filter.ServerFilterPhase;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Filter(Filter.MATCH_ALL_PATTERN)
public class RequestLoggingFilter implements HttpServerFilter {
    private static final Logger METRICS = LoggerFactory.getLogger("api_metrics");

    private final RequestMetrics metrics;

    public RequestLoggingFilter(RequestMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public Publisher<MutableHttpResponse<?>> doFilter(HttpRequest<?> request, ServerFilterChain chain) {
        long start = System.nanoTime();
        return Publishers.map(chain.proceed(request), response -> {
            long millis = (System.nanoTime() - start) / 1_000_000;
            int lastHour = metrics.record();
            METRICS.info("{} {} status={} duration_ms={} requests_last_hour={}",
                request.getMethod(), request.getPath(), response.getStatus().getCode(), millis, lastHour);
            return response;
        });
    }

    // Outside the API key check so rejected requests are counted too.
    @Override
    public int getOrder() {
        return ServerFilterPhase.METRICS.order();
    }
}
