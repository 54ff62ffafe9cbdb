package com.di.datapipe.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DatasetCatalog Tests")
class DatasetCatalogTest {

    private static DatasetRegistration registration(String id, String filename) {
        return DatasetRegistration.builder()
                .descriptor(DatasetDescriptor.builder().id(id).gcsBucket("landing").filename(filename).build())
                .build();
    }

    @Test
    @DisplayName("Should reject duplicate dataset ids")
    void testDuplicateIds() {
        List<DatasetRegistration> regs = List.of(registration("A", "a"), registration("A", "b"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new DatasetCatalog(regs));
        assertTrue(e.getMessage().contains("Duplicate dataset id"));
    }

    @Test
    @DisplayName("Should reject an invalid descriptor at startup")
    void testInvalidDescriptor() {
        DatasetRegistration noBucket = DatasetRegistration.builder()
                .descriptor(DatasetDescriptor.builder().id("A").filename("a").build())
                .build();
        assertThrows(IllegalArgumentException.class, () -> new DatasetCatalog(List.of(noBucket)));
    }

    @Test
    @DisplayName("Should default the fetcher type to http")
    void testFetcherFor() {
        DatasetCatalog catalog = new DatasetCatalog(List.of(registration("A", "a")));
        assertEquals("http", catalog.fetcherFor("A"));
        assertEquals("http", catalog.fetcherFor("unknown"));
        assertTrue(catalog.find("A").isPresent());
        assertTrue(catalog.find("B").isEmpty());
    }
}
