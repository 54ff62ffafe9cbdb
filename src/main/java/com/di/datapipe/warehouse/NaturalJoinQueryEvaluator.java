package com.di.datapipe.warehouse;

import com.di.datapipe.exception.MalformedInputException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Understands one query shape, enough for local runs of derived tables:
 *
 * <pre>SELECT * FROM a [NATURAL JOIN b [NATURAL JOIN c ...]]</pre>
 *
 * Rows are matched on equal values of every column the two sides share. Output columns are the
 * left side's columns followed by the right side's non-shared columns. With no shared columns the
 * result is the cross product.
 */
public class NaturalJoinQueryEvaluator implements QueryEvaluator {

    private static final Pattern QUERY = Pattern.compile(
            "(?is)^\\s*SELECT\\s+\\*\\s+FROM\\s+`?(\\w+)`?((?:\\s+NATURAL\\s+JOIN\\s+`?\\w+`?)*)\\s*;?\\s*$");
    private static final Pattern JOINED = Pattern.compile("(?i)NATURAL\\s+JOIN\\s+`?(\\w+)`?");

    @Override
    public WarehouseTable evaluate(String query, Function<String, Optional<WarehouseTable>> tables) {
        if (query == null) {
            throw new MalformedInputException("Query is empty");
        }
        Matcher m = QUERY.matcher(query);
        if (!m.matches()) {
            throw new MalformedInputException("Unsupported query for the in-memory warehouse: " + query.trim());
        }
        WarehouseTable result = lookup(m.group(1), tables);
        Matcher joins = JOINED.matcher(m.group(2));
        while (joins.find()) {
            result = naturalJoin(result, lookup(joins.group(1), tables));
        }
        return result;
    }

    private static WarehouseTable lookup(String name, Function<String, Optional<WarehouseTable>> tables) {
        return tables.apply(name)
                .orElseThrow(() -> new MalformedInputException("Query references missing table " + name));
    }

    static WarehouseTable naturalJoin(WarehouseTable left, WarehouseTable right) {
        List<String> shared = new ArrayList<>();
        for (String c : left.getColumns()) {
            if (right.getColumns().contains(c)) {
                shared.add(c);
            }
        }
        List<Integer> rightExtra = new ArrayList<>();
        List<String> columns = new ArrayList<>(left.getColumns());
        for (int i = 0; i < right.getColumns().size(); i++) {
            if (!shared.contains(right.getColumns().get(i))) {
                rightExtra.add(i);
                columns.add(right.getColumns().get(i));
            }
        }

        // index the right side by its shared-column key, preserving row order
        Map<List<String>, List<List<String>>> index = new LinkedHashMap<>();
        for (List<String> row : right.getRows()) {
            index.computeIfAbsent(key(row, right, shared), k -> new ArrayList<>()).add(row);
        }

        List<List<String>> rows = new ArrayList<>();
        for (List<String> l : left.getRows()) {
            for (List<String> r : index.getOrDefault(key(l, left, shared), List.of())) {
                List<String> out = new ArrayList<>(l);
                for (int i : rightExtra) {
                    out.add(r.get(i));
                }
                rows.add(out);
            }
        }
        return new WarehouseTable(columns, rows);
    }

    private static List<String> key(List<String> row, WarehouseTable table, List<String> shared) {
        List<String> key = new ArrayList<>(shared.size());
        for (String c : shared) {
            key.add(row.get(table.columnIndex(c)));
        }
        return key;
    }
}
