package com.di.datapipe.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Converts a JSON "values" body, an array of rows whose first row holds the column names, into CSV
 * with a header row. Census-style APIs answer in this shape.
 */
@Slf4j
public final class ValuesJsonToCsv {

    private static final ObjectMapper JSON = new ObjectMapper();

    private ValuesJsonToCsv() {}

    /**
     * @return the CSV bytes, or empty when {@code body} is not a values array
     */
    public static Optional<byte[]> convert(byte[] body) {
        if (body == null || !startsWithArray(body)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = JSON.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Body starts with '[' but is not JSON; passing through: {}", e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read in-memory JSON", e);
        }
        if (root == null || !root.isArray() || root.isEmpty()) {
            return Optional.empty();
        }
        for (JsonNode row : root) {
            if (!row.isArray()) {
                return Optional.empty();
            }
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length);
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            for (JsonNode row : root) {
                String[] cells = new String[row.size()];
                for (int i = 0; i < row.size(); i++) {
                    JsonNode cell = row.get(i);
                    cells[i] = cell == null || cell.isNull() ? "" : cell.asText();
                }
                csv.writeNext(cells);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write CSV", e);
        }
        return Optional.of(out.toByteArray());
    }

    private static boolean startsWithArray(byte[] body) {
        for (byte b : body) {
            if (!Character.isWhitespace(b)) {
                return b == '[';
            }
        }
        return false;
    }
}
