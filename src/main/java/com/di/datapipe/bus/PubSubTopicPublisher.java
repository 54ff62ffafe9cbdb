package com.di.datapipe.bus;

import com.di.datapipe.exception.TransientStageException;
import com.di.datapipe.metrics.PipelineMetrics;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.TopicName;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Google Cloud Pub/Sub topic. {@link #publish} blocks on the publish future, bounded by
 * {@code publishTimeout}, so a returned message id means the server has stored the message.
 */
@Slf4j
public class PubSubTopicPublisher implements TopicPublisher, AutoCloseable {

    private final String topic;
    private final Publisher publisher;
    private final Duration publishTimeout;
    private final PipelineMetrics metrics;

    public PubSubTopicPublisher(String topic, Publisher publisher, Duration publishTimeout, PipelineMetrics metrics) {
        this.topic = topic;
        this.publisher = publisher;
        this.publishTimeout = publishTimeout;
        this.metrics = metrics;
    }

    public static PubSubTopicPublisher create(String projectId, String topic, Duration publishTimeout,
                                              PipelineMetrics metrics) throws IOException {
        Publisher publisher = Publisher.newBuilder(TopicName.of(projectId, topic)).build();
        return new PubSubTopicPublisher(topic, publisher, publishTimeout, metrics);
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public String publish(byte[] data, Map<String, String> attributes) {
        PubsubMessage.Builder message = PubsubMessage.newBuilder().setData(ByteString.copyFrom(data));
        if (attributes != null) {
            message.putAllAttributes(attributes);
        }
        try {
            String messageId = publisher.publish(message.build())
                    .get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordPublish(topic, true);
            log.debug("[BUS] published messageId={} to topic={}", messageId, topic);
            return messageId;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordPublish(topic, false);
            throw new TransientStageException("Interrupted publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            metrics.recordPublish(topic, false);
            throw new TransientStageException("Publish to " + topic + " not confirmed", e);
        }
    }

    @Override
    public void close() throws InterruptedException {
        publisher.shutdown();
        publisher.awaitTermination(30, TimeUnit.SECONDS);
    }
}
