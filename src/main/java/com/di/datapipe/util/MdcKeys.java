package com.di.datapipe.util;

/**
 * MDC keys used across stages. The logback pattern prints them when present.
 */
public final class MdcKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String REQUEST_PATH = "requestPath";
    public static final String SUBSCRIPTION = "subscription";
    public static final String MESSAGE_ID = "messageId";
    public static final String DATASET_ID = "datasetId";
    public static final String JOB_ID = "jobId";
    public static final String JOIN = "join";

    private MdcKeys() {}
}
