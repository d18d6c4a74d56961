package com.acme.events.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Configuration for broker subjects and message sizing.
 */
@ConfigurationProperties("messaging")
public class MessagingConfig {

    /** Working subject; the listener binds to it at compile time. */
    public static final String INGEST_SUBJECT = "events.ingest";
    public static final String DEAD_LETTER_SUBJECT = "events.dlq";

    private Subjects subjects = new Subjects();
    private String consumerGroup = "events-workers";
    private int maxEventsPerRequest = 5000;
    private int maxEventsPerMessage = 1000;
    private int maxMessageBytes = 4 * 1024 * 1024;

    public Subjects getSubjects() {
        return subjects;
    }

    public void setSubjects(Subjects subjects) {
        this.subjects = subjects;
    }

    /**
     * Name shared by every worker consuming the working subject.
     * Used as the MQ application name so operators can see the group on the queue manager.
     */
    public String getConsumerGroup() {
        return consumerGroup;
    }

    public void setConsumerGroup(String consumerGroup) {
        this.consumerGroup = consumerGroup;
    }

    public int getMaxEventsPerRequest() {
        return maxEventsPerRequest;
    }

    public void setMaxEventsPerRequest(int maxEventsPerRequest) {
        this.maxEventsPerRequest = maxEventsPerRequest;
    }

    public int getMaxEventsPerMessage() {
        return maxEventsPerMessage;
    }

    public void setMaxEventsPerMessage(int maxEventsPerMessage) {
        this.maxEventsPerMessage = maxEventsPerMessage;
    }

    public int getMaxMessageBytes() {
        return maxMessageBytes;
    }

    public void setMaxMessageBytes(int maxMessageBytes) {
        this.maxMessageBytes = maxMessageBytes;
    }

    @ConfigurationProperties("subjects")
    public static class Subjects {
        private String ingest = INGEST_SUBJECT;
        private String deadLetter = DEAD_LETTER_SUBJECT;

        public String getIngest() {
            return ingest;
        }

        public void setIngest(String ingest) {
            this.ingest = ingest;
        }

        public String getDeadLetter() {
            return deadLetter;
        }

        public void setDeadLetter(String deadLetter) {
            this.deadLetter = deadLetter;
        }
    }
}
