package com.acme.events.mq;

import com.acme.events.core.Envelope;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps JMS messages to {@link Envelope}. Only application properties become headers.
 */
public final class Mappers {

    private Mappers() {
    }

    public static Envelope toEnvelope(String text, Message m) throws JMSException {
        Map<String,String> headers = new HashMap<>();
        var names = m.getPropertyNames();
        while (names.hasMoreElements()) {
            String name = (String) names.nextElement();
            if (isProviderProperty(name)) {
                continue;
            }
            String value = m.getStringProperty(name);
            if (value != null) {
                headers.put(name, value);
            }
        }
        String subject = m.getJMSDestination() != null ? queueName(m.getJMSDestination().toString()) : null;
        return new Envelope(m.getJMSMessageID(), subject, headers, text);
    }

    static boolean isProviderProperty(String name) {
        return name.startsWith("JMS_IBM_") || name.startsWith("JMSX") || name.startsWith("JMS_");
    }

    static String queueName(String destination) {
        if (destination == null || destination.isBlank()) {
            return null;
        }
        String cleaned = destination;
        if (cleaned.startsWith("queue:///")) {
            cleaned = cleaned.substring("queue:///".length());
        }
        int params = cleaned.indexOf('?');
        return params >= 0 ? cleaned.substring(0, params) : cleaned;
    }
}
