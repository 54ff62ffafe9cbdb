package com.di.datapipe.bus;

import com.di.datapipe.util.MdcKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Logs every dead letter on the {@code DLQ} logger and keeps the most recent ones in memory for the
 * status API. Replay is manual: fix the content or config, then trigger the dataset again.
 */
public class LoggingDeadLetterSink implements DeadLetterSink {

    private static final Logger DLQ = LoggerFactory.getLogger("DLQ");

    private final int capacity;
    private final Deque<DeadLetter> retained = new ArrayDeque<>();

    public LoggingDeadLetterSink(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public void accept(DeadLetter deadLetter) {
        try (MDC.MDCCloseable m = MDC.putCloseable(MdcKeys.MESSAGE_ID, deadLetter.getMessageId())) {
            DLQ.error("DLQ subscription={} attempts={} category={} reason={} payload={}",
                    deadLetter.getSubscription(), deadLetter.getAttempts(), deadLetter.getCategory(),
                    deadLetter.getReason(), deadLetter.getPayload());
        }
        synchronized (retained) {
            retained.addFirst(deadLetter);
            while (retained.size() > capacity) {
                retained.removeLast();
            }
        }
    }

    @Override
    public List<DeadLetter> recent(int limit) {
        List<DeadLetter> out = new ArrayList<>();
        synchronized (retained) {
            Iterator<DeadLetter> it = retained.iterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
        }
        return out;
    }
}
