package com.di.datapipe.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValuesJsonToCsv Tests")
class ValuesJsonToCsvTest {

    private static Optional<String> convert(String body) {
        return ValuesJsonToCsv.convert(body.getBytes(StandardCharsets.UTF_8))
                .map(b -> new String(b, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should turn a values array into CSV with the first row as header")
    void testConvert_ValuesArray() {
        String body = "[[\"NAME\",\"SAEMHI_PT\",\"state\"],\n[\"Alabama\",\"59674\",\"01\"],\n[\"Alaska, AK\",null,\"02\"]]";

        String csv = convert(body).orElseThrow();

        assertEquals("\"NAME\",\"SAEMHI_PT\",\"state\"\n"
                + "\"Alabama\",\"59674\",\"01\"\n"
                + "\"Alaska, AK\",\"\",\"02\"\n", csv);
    }

    @Test
    @DisplayName("Should keep numbers and booleans as their text")
    void testConvert_ScalarCells() {
        assertEquals("\"a\",\"b\"\n\"1\",\"true\"\n", convert("  [[\"a\",\"b\"],[1,true]]").orElseThrow());
    }

    @Test
    @DisplayName("Should pass through anything that is not a values array")
    void testConvert_PassThrough() {
        assertTrue(convert("state,county\n01,001\n").isEmpty());
        assertTrue(convert("{\"rows\":[]}").isEmpty());
        assertTrue(convert("[]").isEmpty());
        assertTrue(convert("[{\"a\":1}]").isEmpty());
        assertTrue(convert("[not json").isEmpty());
        assertTrue(ValuesJsonToCsv.convert(null).isEmpty());
    }
}
