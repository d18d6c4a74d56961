package com.acme.events.spi;

import com.acme.events.core.DeadLetterRecord;

public interface DeadLetterSink {
    void publish(DeadLetterRecord record);
}
