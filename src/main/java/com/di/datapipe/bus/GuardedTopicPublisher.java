package com.di.datapipe.bus;

import com.di.datapipe.security.AccessPolicy;
import com.di.datapipe.security.Permission;
import com.di.datapipe.security.StageIdentity;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Publisher bound to a stage identity. Each topic names the permission needed to publish to it.
 */
@RequiredArgsConstructor
public class GuardedTopicPublisher implements TopicPublisher {

    private final TopicPublisher delegate;
    private final Permission publishPermission;
    private final StageIdentity identity;
    private final AccessPolicy policy;

    @Override
    public String topic() {
        return delegate.topic();
    }

    @Override
    public String publish(byte[] data, Map<String, String> attributes) {
        policy.require(identity, publishPermission, "topic " + delegate.topic());
        return delegate.publish(data, attributes);
    }
}
