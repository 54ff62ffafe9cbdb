package com.di.datapipe.ingestion;

import com.di.datapipe.model.DatasetDescriptor;

import java.util.List;

/**
 * Retrieves a dataset from its source. Implementations are Spring beans discovered by
 * {@link FetcherRegistry}; {@link #type()} is the name datasets select them by.
 */
public interface DatasetFetcher {

    String type();

    /**
     * @return at least one object
     * @throws com.di.datapipe.exception.PipelineException on source failures, categorised so that
     *         network trouble is retried
     */
    List<FetchedObject> fetch(DatasetDescriptor descriptor);
}
