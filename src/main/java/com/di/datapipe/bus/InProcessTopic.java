package com.di.datapipe.bus;

import com.di.datapipe.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process topic fanning each published message out to its push subscriptions.
 * Publishing is durable as soon as every subscription has accepted the message.
 */
@Slf4j
public class InProcessTopic implements TopicPublisher {

    private final String topic;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final List<PushSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public InProcessTopic(String topic, PipelineMetrics metrics) {
        this.topic = topic;
        this.metrics = metrics;
        this.clock = Clock.systemUTC();
    }

    public void subscribe(PushSubscription subscription) {
        subscriptions.add(subscription);
        log.info("[BUS] topic={} → subscription={}", topic, subscription.name());
    }

    public List<PushSubscription> subscriptions() {
        return List.copyOf(subscriptions);
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public String publish(byte[] data, Map<String, String> attributes) {
        String messageId = topic + "-" + sequence.incrementAndGet();
        PushMessage message = PushMessage.builder()
                .messageId(messageId)
                .data(data.clone())
                .attributes(attributes == null ? Map.of() : attributes)
                .publishTime(clock.instant())
                .build();
        for (PushSubscription subscription : subscriptions) {
            subscription.deliver(message);
        }
        metrics.recordPublish(topic, true);
        log.debug("[BUS] published messageId={} to topic={} ({} subscriptions)", messageId, topic, subscriptions.size());
        return messageId;
    }
}
