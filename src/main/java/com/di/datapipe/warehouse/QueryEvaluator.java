package com.di.datapipe.warehouse;

import java.util.Optional;
import java.util.function.Function;

/**
 * Evaluates a join query against the in-memory warehouse's tables.
 */
public interface QueryEvaluator {

    /**
     * @param tables lookup of existing tables by name
     * @throws com.di.datapipe.exception.MalformedInputException when the query is not understood or
     *         references a missing table
     */
    WarehouseTable evaluate(String query, Function<String, Optional<WarehouseTable>> tables);
}
