package com.di.datapipe.ingestion;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry of {@link DatasetFetcher}s by type. Lookup is case-insensitive; duplicate types are
 * rejected at startup.
 */
@Slf4j
public class FetcherRegistry {

    private final Map<String, DatasetFetcher> fetchersByType;

    public FetcherRegistry(List<DatasetFetcher> fetchers) {
        Map<String, DatasetFetcher> map = new TreeMap<>();
        for (DatasetFetcher f : fetchers) {
            DatasetFetcher previous = map.put(normalize(f.type()), f);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate fetcher type '%s': %s and %s",
                        f.type(), previous.getClass().getSimpleName(), f.getClass().getSimpleName()));
            }
        }
        if (map.isEmpty()) {
            log.warn("No DatasetFetcher beans found. Registry will be empty.");
        }
        this.fetchersByType = Collections.unmodifiableMap(map);
        log.info("Registered {} fetcher type(s): {}", fetchersByType.size(), fetchersByType.keySet());
    }

    /**
     * @throws IllegalArgumentException if no fetcher has the given type
     */
    public DatasetFetcher get(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Fetcher type cannot be null or blank");
        }
        DatasetFetcher fetcher = fetchersByType.get(normalize(type));
        if (fetcher == null) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported fetcher type: '%s'. Available types: %s", type, fetchersByType.keySet()));
        }
        return fetcher;
    }

    public Set<String> getRegisteredTypes() {
        return fetchersByType.keySet();
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
