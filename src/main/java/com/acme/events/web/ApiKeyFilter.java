package com.acme.events.web;

import com.acme.events.config.ApiConfig;
import com.acme.events.core.Jsons;
import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Filter;
import io.micronaut.http.filter.HttpServerFilter;
import io.micronaut.http.filter.ServerFilterChain;
import io.micronaut.http.filter.ServerFilterPhase;
import java.util.Set;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects requests without a known {@code X-API-Key}. The service endpoints stay open.
 */
@Filter(Filter.MATCH_ALL_PATTERN)
public class ApiKeyFilter implements HttpServerFilter {
    private static final Logger LOG = LoggerFactory.getLogger(ApiKeyFilter.class);

    public static final String HEADER = "X-API-Key";
    static final Set<String> OPEN_PATHS = Set.of("/", "/health");

    private final ApiConfig config;

    public ApiKeyFilter(ApiConfig config) {
        this.config = config;
    }

    @Override
    public Publisher<MutableHttpResponse<?>> doFilter(HttpRequest<?> request, ServerFilterChain chain) {
        if (!config.isEnabled() || OPEN_PATHS.contains(request.getPath())) {
            return chain.proceed(request);
        }
        if (config.accepts(request.getHeaders().get(HEADER))) {
            return chain.proceed(request);
        }
        LOG.warn("Rejected {} {}: invalid or missing API key", request.getMethod(), request.getPath());
        MutableHttpResponse<?> rejected = HttpResponse.status(HttpStatus.UNAUTHORIZED)
            .contentType(MediaType.APPLICATION_JSON_TYPE)
            .body(Jsons.error("Invalid or missing API key"));
        return Publishers.just(rejected);
    }

    @Override
    public int getOrder() {
        return ServerFilterPhase.SECURITY.order();
    }
}
