package com.di.datapipe.ingestion;

import lombok.Value;

/**
 * One object produced by a fetch. {@code suffix} is appended to the descriptor's file prefix; it is
 * ignored for descriptors with an exact filename.
 */
@Value
public class FetchedObject {

    String suffix;

    byte[] content;

    String contentType;
}
