package com.acme.events.web;

import com.acme.events.core.Jsons;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.LinkedHashMap;
import java.util.Map;

@Controller(produces = MediaType.APPLICATION_JSON)
public class ServiceController {
    static final String NAME = "Event Analytics API";
    static final String VERSION = "1.0.0";

    @Get("/")
    public HttpResponse<?> root() {
        var body = new LinkedHashMap<String, String>();
        body.put("message", NAME);
        body.put("version", VERSION);
        return HttpResponse.ok(Jsons.toJson(body));
    }

    @Get("/health")
    public HttpResponse<?> health() {
        return HttpResponse.ok(Jsons.toJson(Map.of("status", "healthy")));
    }
}
