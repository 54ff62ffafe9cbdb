package com.di.datapipe.warehouse;

import java.util.Optional;

/**
 * Tabular warehouse. Both job kinds block until the job reaches a terminal state and always write
 * with truncate semantics: the target table is replaced, never appended to.
 *
 * <p>Failures are thrown as {@link com.di.datapipe.exception.PipelineException} subclasses so the
 * caller can tell malformed content from transient outages.
 */
public interface Warehouse {

    JobResult runLoad(LoadJobSpec spec);

    JobResult runQuery(QueryJobSpec spec);

    /** Row count of {@code table}, empty when the table does not exist. */
    Optional<Long> rowCount(String table);
}
