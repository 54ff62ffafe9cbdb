package com.di.datapipe.warehouse;

import lombok.Builder;
import lombok.Value;

/** Query whose result wholly replaces {@code destinationTable}. */
@Value
@Builder
public class QueryJobSpec {

    String jobId;

    String destinationTable;

    String query;
}
