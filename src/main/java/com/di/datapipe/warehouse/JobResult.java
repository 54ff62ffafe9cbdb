package com.di.datapipe.warehouse;

import lombok.Value;

/** Terminal, successful outcome of a warehouse job. */
@Value
public class JobResult {

    String jobId;

    String table;

    long rowCount;

    long durationMs;
}
