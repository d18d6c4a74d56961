package com.acme.events.mq;

import com.acme.events.config.MqConfig;
import com.ibm.mq.jakarta.jms.MQConnectionFactory;
import com.ibm.msg.client.jakarta.wmq.WMQConstants;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IbmMqFactoryProviderTest {

    @Test
    void testConfiguresClientConnection() throws Exception {
        var mq = new MqConfig();
        mq.setHost("mq.internal");
        mq.setPort(1415);
        mq.setQueueManager("QM_EVENTS");
        mq.setChannel("EVENTS.SVRCONN");

        var cf = IbmMqFactoryProvider.configure(new MQConnectionFactory(), mq, "events-workers");

        assertEquals(WMQConstants.WMQ_CM_CLIENT, cf.getTransportType());
        assertEquals("mq.internal", cf.getHostName());
        assertEquals(1415, cf.getPort());
        assertEquals("QM_EVENTS", cf.getQueueManager());
        assertEquals("EVENTS.SVRCONN", cf.getChannel());
        assertEquals("events-workers", cf.getAppName());
    }

    @Test
    void testCredentialsEnableMqcsp() throws Exception {
        var mq = new MqConfig();
        mq.setUser("app");
        mq.setPassword("s3cret");

        var cf = IbmMqFactoryProvider.configure(new MQConnectionFactory(), mq, "events-workers");

        assertTrue(cf.getBooleanProperty(WMQConstants.USER_AUTHENTICATION_MQCSP));
        assertEquals("app", cf.getStringProperty(WMQConstants.USERID));
    }
}
