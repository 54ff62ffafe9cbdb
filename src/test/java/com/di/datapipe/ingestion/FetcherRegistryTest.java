package com.di.datapipe.ingestion;

import com.di.datapipe.model.DatasetDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FetcherRegistry Tests")
class FetcherRegistryTest {

    private static DatasetFetcher fetcher(String type) {
        return new DatasetFetcher() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public List<FetchedObject> fetch(DatasetDescriptor descriptor) {
                return List.of();
            }
        };
    }

    @Test
    @DisplayName("Lookup is case-insensitive")
    void testGet_CaseInsensitive() {
        DatasetFetcher http = fetcher("http");
        FetcherRegistry registry = new FetcherRegistry(List.of(http, fetcher("ftp")));

        assertSame(http, registry.get("HTTP"));
        assertSame(http, registry.get(" http "));
        assertEquals(Set.of("ftp", "http"), registry.getRegisteredTypes());
    }

    @Test
    @DisplayName("Unknown or blank types are rejected")
    void testGet_Unknown() {
        FetcherRegistry registry = new FetcherRegistry(List.of(fetcher("http")));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.get("s3"));
        assertTrue(e.getMessage().contains("http"));
        assertThrows(IllegalArgumentException.class, () -> registry.get(""));
    }

    @Test
    @DisplayName("Duplicate types fail at startup")
    void testDuplicateTypes() {
        assertThrows(IllegalStateException.class,
                () -> new FetcherRegistry(List.of(fetcher("http"), fetcher("HTTP"))));
    }
}
