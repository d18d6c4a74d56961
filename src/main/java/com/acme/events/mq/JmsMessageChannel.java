package com.acme.events.mq;

import com.acme.events.spi.MessageChannel;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends text messages with one transacted session per thread. A delivery delay is handed to the
 * broker (JMS 2.0), so retries wait on the queue manager instead of in a worker thread.
 */
@Singleton
@Requires(beans = IbmMqFactoryProvider.class)
public class JmsMessageChannel implements MessageChannel {
    private static final Logger LOG = LoggerFactory.getLogger(JmsMessageChannel.class);

    private final jakarta.jms.Connection connection;
    private final ThreadLocal<SessionHolder> sessionPool;

    public JmsMessageChannel(@Named("mqConnectionFactory") jakarta.jms.ConnectionFactory cf) {
        try {
            this.connection = cf.createConnection();
            this.connection.start();
            LOG.info("JMS connection initialized and started");
        } catch (jakarta.jms.JMSException e) {
            throw new IllegalStateException("Failed to initialize JMS connection", e);
        }

        this.sessionPool = ThreadLocal.withInitial(() -> {
            try {
                LOG.debug("Creating new JMS session for thread {}", Thread.currentThread().getName());
                return new SessionHolder(connection.createSession(true, jakarta.jms.Session.SESSION_TRANSACTED));
            } catch (jakarta.jms.JMSException e) {
                throw new IllegalStateException("Failed to create JMS session", e);
            }
        });
    }

    @Override
    public void send(String subject, String body, Map<String,String> headers, Duration deliveryDelay) {
        SessionHolder holder = sessionPool.get();

        try {
            var session = holder.session;
            var msg = session.createTextMessage(body);
            applyHeaders(msg, headers);

            holder.producer.setDeliveryDelay(deliveryDelay == null ? 0L : deliveryDelay.toMillis());
            holder.producer.send(session.createQueue(subject), msg);
            session.commit();
        } catch (Exception e) {
            try {
                holder.session.rollback();
            } catch (jakarta.jms.JMSException rollbackEx) {
                LOG.warn("Failed to rollback JMS session", rollbackEx);
            }

            holder.close();
            sessionPool.remove();

            throw new IllegalStateException("Failed to send message to " + subject, e);
        }
    }

    static void applyHeaders(jakarta.jms.Message msg, Map<String,String> headers) throws jakarta.jms.JMSException {
        if (headers == null) {
            return;
        }
        for (var e : headers.entrySet()) {
            if (e.getValue() == null || Mappers.isProviderProperty(e.getKey())) {
                continue;
            }
            msg.setStringProperty(e.getKey(), e.getValue());
        }
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down JMS connection");
        try {
            sessionPool.remove();
            connection.close();
        } catch (Exception e) {
            LOG.warn("Error during JMS shutdown", e);
        }
    }

    private static class SessionHolder {
        final jakarta.jms.Session session;
        final jakarta.jms.MessageProducer producer;

        SessionHolder(jakarta.jms.Session session) throws jakarta.jms.JMSException {
            this.session = session;
            this.producer = session.createProducer(null);
        }

        void close() {
            try {
                producer.close();
            } catch (jakarta.jms.JMSException e) {
                LOG.debug("Error closing producer", e);
            }
            try {
                session.close();
            } catch (jakarta.jms.JMSException e) {
                LOG.debug("Error closing session", e);
            }
        }
    }
}
