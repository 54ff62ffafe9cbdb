package com.di.datapipe.support;

import com.di.datapipe.bus.TopicPublisher;
import com.di.datapipe.exception.TransientStageException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Records published payloads; fails the first {@code failures} publishes with a transient error. */
public class RecordingTopicPublisher implements TopicPublisher {

    private final String topic;
    private final AtomicInteger remainingFailures;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<byte[]> published = new CopyOnWriteArrayList<>();

    public RecordingTopicPublisher(String topic) {
        this(topic, 0);
    }

    public RecordingTopicPublisher(String topic, int failures) {
        this.topic = topic;
        this.remainingFailures = new AtomicInteger(failures);
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public String publish(byte[] data, Map<String, String> attributes) {
        int call = calls.incrementAndGet();
        if (remainingFailures.getAndDecrement() > 0) {
            throw new TransientStageException("publish to " + topic + " not confirmed");
        }
        published.add(data.clone());
        return topic + "-" + call;
    }

    public List<byte[]> published() {
        return published;
    }

    public int calls() {
        return calls.get();
    }
}
