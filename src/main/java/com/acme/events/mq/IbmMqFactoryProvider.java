package com.acme.events.mq;

import com.acme.events.config.MessagingConfig;
import com.acme.events.config.MqConfig;
import com.ibm.mq.jakarta.jms.MQConnectionFactory;
import com.ibm.msg.client.jakarta.wmq.WMQConstants;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.jms.annotations.JMSConnectionFactory;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-mode connection factory for the queue manager. Every worker registers under the consumer
 * group as its MQ application name.
 */
@Requires(notEnv = "test")
@Factory
public class IbmMqFactoryProvider {
    private static final Logger LOG = LoggerFactory.getLogger(IbmMqFactoryProvider.class);

    private final MqConfig mq;
    private final String consumerGroup;

    public IbmMqFactoryProvider(MqConfig mq, MessagingConfig messaging) {
        this.mq = mq;
        this.consumerGroup = messaging.getConsumerGroup();
    }

    @JMSConnectionFactory("mqConnectionFactory")
    public ConnectionFactory mqConnectionFactory() throws JMSException {
        LOG.info("Connecting to queue manager {} at {}:{} as {}", mq.getQueueManager(), mq.getHost(), mq.getPort(),
            consumerGroup);
        return configure(new MQConnectionFactory(), mq, consumerGroup);
    }

    static MQConnectionFactory configure(MQConnectionFactory cf, MqConfig mq, String appName) throws JMSException {
        cf.setTransportType(WMQConstants.WMQ_CM_CLIENT);
        cf.setHostName(mq.getHost());
        cf.setPort(mq.getPort());
        cf.setQueueManager(mq.getQueueManager());
        cf.setChannel(mq.getChannel());
        cf.setAppName(appName);
        if (mq.hasCredentials()) {
            cf.setBooleanProperty(WMQConstants.USER_AUTHENTICATION_MQCSP, true);
            cf.setStringProperty(WMQConstants.USERID, mq.getUser());
            cf.setStringProperty(WMQConstants.PASSWORD, mq.getPassword() == null ? "" : mq.getPassword());
        }
        // Reconnect transparently after a queue manager restart; share one TCP connection per client.
        cf.setIntProperty(WMQConstants.WMQ_CLIENT_RECONNECT_OPTIONS, WMQConstants.WMQ_CLIENT_RECONNECT);
        cf.setIntProperty(WMQConstants.WMQ_SHARE_CONV_ALLOWED, WMQConstants.WMQ_SHARE_CONV_ALLOWED_YES);
        return cf;
    }
}
