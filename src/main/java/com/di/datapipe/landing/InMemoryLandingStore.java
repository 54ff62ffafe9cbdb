package com.di.datapipe.landing;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory landing store for the local runtime and tests. A put replaces the whole object, matching
 * object-store overwrite semantics.
 */
@Slf4j
public class InMemoryLandingStore implements LandingStore {

    private final ConcurrentMap<String, ConcurrentMap<String, byte[]>> buckets = new ConcurrentHashMap<>();

    @Override
    public void write(String bucket, String objectName, byte[] content, String contentType) {
        buckets.computeIfAbsent(bucket, b -> new ConcurrentHashMap<>())
                .put(objectName, content.clone());
        log.debug("[LANDING] wrote gs://{}/{} ({} bytes)", bucket, objectName, content.length);
    }

    @Override
    public Optional<byte[]> read(String bucket, String objectName) {
        Map<String, byte[]> objects = buckets.get(bucket);
        if (objects == null) {
            return Optional.empty();
        }
        byte[] content = objects.get(objectName);
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    @Override
    public List<String> list(String bucket, String prefix) {
        Map<String, byte[]> objects = buckets.get(bucket);
        if (objects == null) {
            return List.of();
        }
        return objects.keySet().stream()
                .filter(name -> prefix == null || name.startsWith(prefix))
                .sorted()
                .collect(Collectors.toList());
    }
}
