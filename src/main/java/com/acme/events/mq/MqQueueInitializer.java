package com.acme.events.mq;

import com.acme.events.config.MessagingConfig;
import com.ibm.mq.MQException;
import com.ibm.mq.constants.MQConstants;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.BeanCreatedEvent;
import io.micronaut.context.event.BeanCreatedEventListener;
import io.micronaut.core.annotation.Order;
import io.micronaut.core.order.Ordered;
import io.micronaut.jms.pool.JMSConnectionPool;
import jakarta.inject.Singleton;
import jakarta.jms.JMSException;
import jakarta.jms.Session;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the working and dead-letter queues exist before listeners start.
 * A missing queue stops the application.
 */
@Singleton
@Requires(beans = IbmMqFactoryProvider.class)
@Requires(property = "jms.consumers.enabled", value = "true", defaultValue = "false")
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MqQueueInitializer implements BeanCreatedEventListener<JMSConnectionPool> {

    private static final Logger LOG = LoggerFactory.getLogger(MqQueueInitializer.class);
    private static final int MQ_ERROR_UNKNOWN_OBJECT = 2085;

    private final List<String> requiredQueues;
    private boolean validated = false;

    public MqQueueInitializer(MessagingConfig config) {
        this.requiredQueues = List.of(config.getSubjects().getIngest(), config.getSubjects().getDeadLetter());
    }

    @Override
    public JMSConnectionPool onCreated(BeanCreatedEvent<JMSConnectionPool> event) {
        if (!validated) {
            validated = true;
            JMSConnectionPool pool = event.getBean();
            LOG.info("Validating IBM MQ queues {}", requiredQueues);

            try (var connection = pool.createConnection();
                 var session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE)) {

                for (String queueName : requiredQueues) {
                    try {
                        var browser = session.createBrowser(session.createQueue(queueName));
                        browser.close();
                        LOG.info("Queue {} exists and is accessible", queueName);
                    } catch (JMSException e) {
                        if (isMissingQueueError(e)) {
                            LOG.error("Queue {} does not exist. Define it with: DEFINE QLOCAL('{}') DEFPSIST(YES)",
                                queueName, queueName);
                        }
                        throw e;
                    }
                }
            } catch (Exception e) {
                LOG.error("Failed to validate IBM MQ queues", e);
                exitApplication("Cannot validate/access IBM MQ queues: " + e.getMessage());
            }
        }

        return event.getBean();
    }

    static boolean isMissingQueueError(JMSException e) {
        if (e.getCause() instanceof MQException mqe) {
            return mqe.getReason() == MQConstants.MQRC_UNKNOWN_OBJECT_NAME;
        }
        return e.getMessage() != null &&
               (e.getMessage().contains("MQRC_UNKNOWN_OBJECT_NAME") ||
                e.getMessage().contains(String.valueOf(MQ_ERROR_UNKNOWN_OBJECT)));
    }

    private void exitApplication(String reason) {
        LOG.error("CRITICAL ERROR: {}", reason);
        LOG.error("Application cannot start. Exiting...");
        System.exit(1);
    }
}
