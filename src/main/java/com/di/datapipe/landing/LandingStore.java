package com.di.datapipe.landing;

import java.util.List;
import java.util.Optional;

/**
 * Durable object storage for raw fetched files. Objects are addressed by bucket and name;
 * a write to an existing name replaces it.
 */
public interface LandingStore {

    /** Writes {@code content}, replacing any existing object. Returns once the write is durable. */
    void write(String bucket, String objectName, byte[] content, String contentType);

    Optional<byte[]> read(String bucket, String objectName);

    /** Object names in {@code bucket} starting with {@code prefix}, sorted. */
    List<String> list(String bucket, String prefix);
}
