package com.di.datapipe.join;

import com.di.datapipe.warehouse.TableNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Static definition of a derived table: the datasets it depends on, the query that builds it and
 * the table the query result replaces.
 */
@Value
@Builder
public class JoinDefinition {

    String name;

    List<String> dependsOn;

    String destinationTable;

    String query;

    /** Warehouse tables of the dependencies, in declaration order. */
    public List<String> dependencyTables() {
        return dependsOn == null ? List.of() : dependsOn.stream().map(TableNaming::forDataset).toList();
    }

    public boolean dependsOnTable(String table) {
        return dependencyTables().contains(table);
    }

    /** Returns a reason the definition is unusable, or {@code null} when it is valid. */
    public String validationError() {
        if (name == null || name.isBlank()) {
            return "join has no name";
        }
        if (dependsOn == null || dependsOn.isEmpty()) {
            return "join " + name + " has no dependencies";
        }
        if (destinationTable == null || destinationTable.isBlank()) {
            return "join " + name + " has no destination table";
        }
        if (query == null || query.isBlank()) {
            return "join " + name + " has no query";
        }
        return null;
    }
}
