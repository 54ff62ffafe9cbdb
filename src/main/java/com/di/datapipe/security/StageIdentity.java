package com.di.datapipe.security;

/**
 * Identities under which the pipeline stages act. Each maps to a distinct service account
 * in the gcp runtime.
 */
public enum StageIdentity {
    SCHEDULER,
    INGESTION,
    LOADER
}
