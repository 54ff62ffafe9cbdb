package com.di.datapipe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Published by the Ingestion Worker once a landing write is durable.
 */
@Value
@Builder
@Jacksonized
public class LandedObjectEvent {

    @JsonProperty("bucket")
    String bucket;

    @JsonProperty("object_name")
    String objectName;

    @JsonProperty("dataset_id")
    String datasetId;

    /** {@code gs://bucket/object} form used as a load source URI. */
    @JsonIgnore
    public String sourceUri() {
        return "gs://" + bucket + "/" + objectName;
    }
}
