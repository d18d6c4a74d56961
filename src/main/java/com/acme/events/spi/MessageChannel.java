package com.acme.events.spi;

import java.time.Duration;
import java.util.Map;

public interface MessageChannel {
    void send(String subject, String body, Map<String,String> headers, Duration deliveryDelay);

    default void send(String subject, String body, Map<String,String> headers) {
        send(subject, body, headers, Duration.ZERO);
    }
}
