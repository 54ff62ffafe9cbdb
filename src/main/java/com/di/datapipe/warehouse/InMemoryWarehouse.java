package com.di.datapipe.warehouse;

import com.di.datapipe.exception.MalformedInputException;
import com.di.datapipe.landing.LandingStore;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Warehouse for the local runtime. Loads read the landed object through the loader's landing store,
 * parse it as CSV and replace the table in one step. Ragged rows, an empty header or an
 * unparseable file are rejected as malformed and leave the existing table untouched.
 */
@Slf4j
public class InMemoryWarehouse implements Warehouse {

    private final LandingStore landing;
    private final QueryEvaluator evaluator;
    private final ConcurrentMap<String, WarehouseTable> tables = new ConcurrentHashMap<>();

    public InMemoryWarehouse(LandingStore landing, QueryEvaluator evaluator) {
        this.landing = landing;
        this.evaluator = evaluator;
    }

    @Override
    public JobResult runLoad(LoadJobSpec spec) {
        long start = System.currentTimeMillis();
        byte[] content = landing.read(spec.getBucket(), spec.getObjectName())
                .orElseThrow(() -> new MalformedInputException("Source object " + spec.sourceUri() + " not found"));

        WarehouseTable table = parse(spec.sourceUri(), content, spec.getSkipLeadingRows());
        tables.put(spec.getTable(), table);

        long elapsed = System.currentTimeMillis() - start;
        log.info("[LOAD] jobId={} replaced table={} with {} rows from {}",
                spec.getJobId(), spec.getTable(), table.rowCount(), spec.sourceUri());
        return new JobResult(spec.getJobId(), spec.getTable(), table.rowCount(), elapsed);
    }

    @Override
    public JobResult runQuery(QueryJobSpec spec) {
        long start = System.currentTimeMillis();
        WarehouseTable result = evaluator.evaluate(spec.getQuery(), name -> Optional.ofNullable(tables.get(name)));
        tables.put(spec.getDestinationTable(), result);
        long elapsed = System.currentTimeMillis() - start;
        log.info("[JOIN] query jobId={} replaced table={} with {} rows",
                spec.getJobId(), spec.getDestinationTable(), result.rowCount());
        return new JobResult(spec.getJobId(), spec.getDestinationTable(), result.rowCount(), elapsed);
    }

    @Override
    public Optional<Long> rowCount(String table) {
        return Optional.ofNullable(tables.get(table)).map(WarehouseTable::rowCount);
    }

    public Optional<WarehouseTable> table(String table) {
        return Optional.ofNullable(tables.get(table));
    }

    /** Canonical CSV rendering of a table (header plus rows), empty when the table does not exist. */
    public Optional<byte[]> tableContent(String table) {
        return table(table).map(InMemoryWarehouse::render);
    }

    static WarehouseTable parse(String source, byte[] content, int skipLeadingRows) {
        List<String[]> records;
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            records = csv.readAll();
        } catch (IOException | CsvException e) {
            throw new MalformedInputException("Unparseable CSV in " + source + ": " + e.getMessage(), e);
        }

        List<String[]> nonBlank = new ArrayList<>(records.size());
        for (String[] r : records) {
            if (!(r.length == 1 && r[0].isEmpty())) {
                nonBlank.add(r);
            }
        }

        List<String> columns;
        int firstData;
        if (skipLeadingRows > 0) {
            if (nonBlank.size() < skipLeadingRows) {
                throw new MalformedInputException("No header row in " + source);
            }
            columns = Arrays.asList(nonBlank.get(skipLeadingRows - 1));
            if (columns.stream().allMatch(String::isBlank)) {
                throw new MalformedInputException("Empty header row in " + source);
            }
            firstData = skipLeadingRows;
        } else {
            if (nonBlank.isEmpty()) {
                throw new MalformedInputException("No rows in " + source);
            }
            columns = new ArrayList<>();
            for (int i = 0; i < nonBlank.get(0).length; i++) {
                columns.add("string_field_" + i);
            }
            firstData = 0;
        }

        List<List<String>> rows = new ArrayList<>(Math.max(0, nonBlank.size() - firstData));
        for (int i = firstData; i < nonBlank.size(); i++) {
            String[] r = nonBlank.get(i);
            if (r.length != columns.size()) {
                throw new MalformedInputException("Row " + (i + 1) + " of " + source + " has " + r.length
                        + " fields, expected " + columns.size());
            }
            rows.add(Arrays.asList(r));
        }
        return new WarehouseTable(columns, rows);
    }

    private static byte[] render(WarehouseTable table) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            csv.writeNext(table.getColumns().toArray(new String[0]));
            for (List<String> row : table.getRows()) {
                csv.writeNext(row.toArray(new String[0]));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render table", e);
        }
        return out.toByteArray();
    }
}
