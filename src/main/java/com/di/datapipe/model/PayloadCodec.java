package com.di.datapipe.model;

import com.di.datapipe.exception.InvalidMessageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON codec for the two bus payloads. Decoding failures surface as {@link InvalidMessageException}
 * so the bus dead-letters them instead of redelivering.
 */
public final class PayloadCodec {

    private static final ObjectMapper JSON = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private PayloadCodec() {}

    public static byte[] encodeFetchRequest(DatasetDescriptor descriptor) {
        return write(descriptor);
    }

    public static DatasetDescriptor decodeFetchRequest(byte[] data) {
        DatasetDescriptor descriptor = read(data, DatasetDescriptor.class);
        String error = descriptor.validationError();
        if (error != null) {
            throw new InvalidMessageException("Invalid FetchRequest: " + error);
        }
        return descriptor;
    }

    public static byte[] encodeLandedObject(LandedObjectEvent event) {
        return write(event);
    }

    public static LandedObjectEvent decodeLandedObject(byte[] data) {
        LandedObjectEvent event = read(data, LandedObjectEvent.class);
        if (event.getBucket() == null || event.getObjectName() == null || event.getDatasetId() == null) {
            throw new InvalidMessageException("Invalid LandedObjectEvent: bucket, object_name and dataset_id are required");
        }
        return event;
    }

    private static byte[] write(Object value) {
        try {
            return JSON.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(byte[] data, Class<T> type) {
        if (data == null || data.length == 0) {
            throw new InvalidMessageException("Empty " + type.getSimpleName() + " payload");
        }
        T value;
        try {
            value = JSON.readValue(data, type);
        } catch (IOException e) {
            throw new InvalidMessageException("Undecodable " + type.getSimpleName() + " payload: " + e.getMessage(), e);
        }
        // the JSON literal null decodes without error
        if (value == null) {
            throw new InvalidMessageException("Null " + type.getSimpleName() + " payload");
        }
        return value;
    }
}
