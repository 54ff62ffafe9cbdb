package com.di.datapipe.model;

import lombok.Builder;
import lombok.Value;

/**
 * A configured dataset: its descriptor plus the scheduling and fetching choices that stay local to
 * this deployment and are never put on the wire.
 */
@Value
@Builder
public class DatasetRegistration {

    DatasetDescriptor descriptor;

    /** Spring cron expression (six fields). */
    String schedule;

    @Builder.Default
    String fetcher = "http";

    @Builder.Default
    boolean enabled = true;

    public String getId() {
        return descriptor.getId();
    }
}
