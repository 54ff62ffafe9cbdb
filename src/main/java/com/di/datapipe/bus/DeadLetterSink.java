package com.di.datapipe.bus;

import java.util.List;

/**
 * Destination for messages the bus has given up on: retries exhausted, or a failure no redelivery
 * can fix.
 */
public interface DeadLetterSink {

    void accept(DeadLetter deadLetter);

    /** Most recent first. */
    List<DeadLetter> recent(int limit);
}
