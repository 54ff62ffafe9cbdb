package com.di.datapipe.model;

import com.di.datapipe.exception.InvalidMessageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PayloadCodec Tests")
class PayloadCodecTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    // ============================================================================
    // FetchRequest
    // ============================================================================

    @Test
    @DisplayName("Should decode a FetchRequest using the wire field names")
    void testDecodeFetchRequest() {
        DatasetDescriptor d = PayloadCodec.decodeFetchRequest(utf8(
                "{\"id\":\"HOUSEHOLD_INCOME\",\"url\":\"https://api.census.gov/data/timeseries/poverty/saipe\","
                        + "\"gcs_bucket\":\"landing\",\"filename\":\"SAIPE\"}"));
        assertEquals("HOUSEHOLD_INCOME", d.getId());
        assertEquals("landing", d.getGcsBucket());
        assertEquals("SAIPE", d.objectName(".csv"));
        assertFalse(d.isPrefixed());
    }

    @Test
    @DisplayName("Should omit absent optional fields when encoding")
    void testEncodeFetchRequest_OmitsNulls() {
        DatasetDescriptor d = DatasetDescriptor.builder().id("X").gcsBucket("b").fileprefix("x_").build();
        String json = new String(PayloadCodec.encodeFetchRequest(d), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"gcs_bucket\":\"b\""));
        assertTrue(json.contains("\"fileprefix\":\"x_\""));
        assertFalse(json.contains("filename"));
        assertFalse(json.contains("url"));
    }

    @Test
    @DisplayName("Should reject a descriptor with both filename and fileprefix")
    void testDecodeFetchRequest_BothNames() {
        InvalidMessageException e = assertThrows(InvalidMessageException.class, () -> PayloadCodec.decodeFetchRequest(
                utf8("{\"id\":\"X\",\"gcs_bucket\":\"b\",\"filename\":\"f\",\"fileprefix\":\"p\"}")));
        assertTrue(e.getMessage().contains("exactly one"));
    }

    @Test
    @DisplayName("Should reject a descriptor with neither filename nor fileprefix")
    void testDecodeFetchRequest_NoName() {
        assertThrows(InvalidMessageException.class,
                () -> PayloadCodec.decodeFetchRequest(utf8("{\"id\":\"X\",\"gcs_bucket\":\"b\"}")));
    }

    @Test
    @DisplayName("Should reject empty and non-JSON payloads")
    void testDecodeFetchRequest_Garbage() {
        assertThrows(InvalidMessageException.class, () -> PayloadCodec.decodeFetchRequest(new byte[0]));
        assertThrows(InvalidMessageException.class, () -> PayloadCodec.decodeFetchRequest(utf8("not json")));
    }

    @Test
    @DisplayName("Should reject the JSON literal null as an invalid message")
    void testDecodeFetchRequest_JsonNull() {
        InvalidMessageException e = assertThrows(InvalidMessageException.class,
                () -> PayloadCodec.decodeFetchRequest(utf8("null")));
        assertFalse(e.getCategory().isRetryable());
    }

    // ============================================================================
    // LandedObjectEvent
    // ============================================================================

    @Test
    @DisplayName("Should decode a LandedObjectEvent and build its source URI")
    void testDecodeLandedObject() {
        LandedObjectEvent e = PayloadCodec.decodeLandedObject(
                utf8("{\"bucket\":\"landing\",\"object_name\":\"SAIPE\",\"dataset_id\":\"HOUSEHOLD_INCOME\"}"));
        assertEquals("gs://landing/SAIPE", e.sourceUri());
        assertEquals("HOUSEHOLD_INCOME", e.getDatasetId());
    }

    @Test
    @DisplayName("Should reject a LandedObjectEvent missing a field")
    void testDecodeLandedObject_MissingField() {
        assertThrows(InvalidMessageException.class,
                () -> PayloadCodec.decodeLandedObject(utf8("{\"bucket\":\"landing\",\"dataset_id\":\"X\"}")));
    }

    @Test
    @DisplayName("Should reject a LandedObjectEvent that is the JSON literal null")
    void testDecodeLandedObject_JsonNull() {
        assertThrows(InvalidMessageException.class, () -> PayloadCodec.decodeLandedObject(utf8(" null ")));
    }
}
