package com.acme.events.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * IBM MQ client connection settings.
 */
@ConfigurationProperties("mq")
public class MqConfig {

    private String host = "localhost";
    private int port = 1414;
    private String queueManager = "QM1";
    private String channel = "DEV.APP.SVRCONN";
    private String user;
    private String password;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getQueueManager() {
        return queueManager;
    }

    public void setQueueManager(String queueManager) {
        this.queueManager = queueManager;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    /** Empty means no MQCSP authentication. */
    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean hasCredentials() {
        return user != null && !user.isBlank();
    }
}
