package com.di.datapipe.warehouse;

import com.di.datapipe.exception.MalformedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NaturalJoinQueryEvaluator Tests")
class NaturalJoinQueryEvaluatorTest {

    private final NaturalJoinQueryEvaluator evaluator = new NaturalJoinQueryEvaluator();

    private final WarehouseTable income = new WarehouseTable(
            List.of("state", "median_income"),
            List.of(List.of("01", "52035"), List.of("02", "77790"), List.of("04", "61529")));

    private final WarehouseTable poverty = new WarehouseTable(
            List.of("state", "poverty_pct"),
            List.of(List.of("01", "16.1"), List.of("04", "13.5"), List.of("06", "12.3")));

    private final Map<String, WarehouseTable> tables = Map.of("household_income", income, "poverty_by_state", poverty);

    private Optional<WarehouseTable> lookup(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    @Test
    @DisplayName("Should join on shared columns and keep left row order")
    void testNaturalJoin() {
        WarehouseTable result = evaluator.evaluate(
                "SELECT * FROM household_income NATURAL JOIN poverty_by_state", this::lookup);

        assertEquals(List.of("state", "median_income", "poverty_pct"), result.getColumns());
        assertEquals(List.of(
                List.of("01", "52035", "16.1"),
                List.of("04", "61529", "13.5")), result.getRows());
    }

    @Test
    @DisplayName("Should return a copy of a single table")
    void testSelectStar() {
        WarehouseTable result = evaluator.evaluate("select * from `household_income`;", this::lookup);
        assertEquals(income, result);
    }

    @Test
    @DisplayName("Should produce the cross product when no columns are shared")
    void testCrossProduct() {
        WarehouseTable a = new WarehouseTable(List.of("x"), List.of(List.of("1"), List.of("2")));
        WarehouseTable b = new WarehouseTable(List.of("y"), List.of(List.of("a"), List.of("b")));
        assertEquals(4, NaturalJoinQueryEvaluator.naturalJoin(a, b).rowCount());
    }

    @Test
    @DisplayName("Should reject unsupported queries and missing tables as malformed")
    void testRejected() {
        assertThrows(MalformedInputException.class,
                () -> evaluator.evaluate("SELECT state FROM household_income", this::lookup));
        assertThrows(MalformedInputException.class,
                () -> evaluator.evaluate("SELECT * FROM household_income NATURAL JOIN missing", this::lookup));
        assertThrows(MalformedInputException.class, () -> evaluator.evaluate(null, this::lookup));
    }
}
