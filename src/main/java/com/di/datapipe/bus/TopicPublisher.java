package com.di.datapipe.bus;

import java.util.Map;

/**
 * At-least-once topic. {@link #publish} returns only once the message is durably accepted.
 */
public interface TopicPublisher {

    String topic();

    /**
     * @return the bus-assigned message id
     * @throws com.di.datapipe.exception.PipelineException when the publish is not confirmed
     */
    String publish(byte[] data, Map<String, String> attributes);
}
