package com.di.datapipe.warehouse;

import lombok.Builder;
import lombok.Value;

/**
 * One load attempt: replace {@code table} with the CSV object at {@code bucket/objectName}, schema
 * auto-detected, the first {@code skipLeadingRows} rows treated as header.
 */
@Value
@Builder
public class LoadJobSpec {

    String jobId;

    String table;

    String bucket;

    String objectName;

    @Builder.Default
    int skipLeadingRows = 1;

    public String sourceUri() {
        return "gs://" + bucket + "/" + objectName;
    }
}
