package com.di.datapipe.model;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All configured datasets, keyed by id. Ids are unique across the system and every descriptor must
 * be valid; both are checked once, at construction.
 */
@Slf4j
public class DatasetCatalog {

    private final Map<String, DatasetRegistration> byId;

    public DatasetCatalog(Collection<DatasetRegistration> registrations) {
        Map<String, DatasetRegistration> map = new LinkedHashMap<>();
        for (DatasetRegistration r : registrations) {
            String error = r.getDescriptor().validationError();
            if (error != null) {
                throw new IllegalArgumentException("Invalid dataset configuration: " + error);
            }
            if (map.put(r.getId(), r) != null) {
                throw new IllegalArgumentException("Duplicate dataset id: " + r.getId());
            }
        }
        this.byId = Collections.unmodifiableMap(map);
        log.info("Registered {} dataset(s): {}", byId.size(), byId.keySet());
    }

    public Optional<DatasetRegistration> find(String datasetId) {
        return Optional.ofNullable(byId.get(datasetId));
    }

    public Collection<DatasetRegistration> all() {
        return byId.values();
    }

    /** Fetcher type for a dataset; datasets not in the catalog use {@code http}. */
    public String fetcherFor(String datasetId) {
        return find(datasetId).map(DatasetRegistration::getFetcher).orElse("http");
    }
}
