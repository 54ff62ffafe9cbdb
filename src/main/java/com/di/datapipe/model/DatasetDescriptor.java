package com.di.datapipe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Static description of one fetchable dataset. Serialised as-is to form a FetchRequest.
 *
 * <p>Exactly one of {@code filename} (exact landing object name) or {@code fileprefix}
 * (prefix for fetcher-generated suffixes) is set.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DatasetDescriptor {

    @JsonProperty("id")
    String id;

    @JsonProperty("url")
    String url;

    @JsonProperty("gcs_bucket")
    String gcsBucket;

    @JsonProperty("filename")
    String filename;

    @JsonProperty("fileprefix")
    String fileprefix;

    /**
     * Landing object name for a fetched object. A {@code filename} descriptor always lands under that
     * exact name; a {@code fileprefix} descriptor lands under prefix + suffix.
     */
    public String objectName(String suffix) {
        if (filename != null) {
            return filename;
        }
        return fileprefix + (suffix == null ? "" : suffix);
    }

    @JsonIgnore
    public boolean isPrefixed() {
        return fileprefix != null;
    }

    /**
     * Returns a reason the descriptor is unusable, or {@code null} when it is valid.
     */
    public String validationError() {
        if (isBlank(id)) {
            return "descriptor has no id";
        }
        if (isBlank(gcsBucket)) {
            return "descriptor " + id + " has no gcs_bucket";
        }
        boolean hasName = !isBlank(filename);
        boolean hasPrefix = !isBlank(fileprefix);
        if (hasName == hasPrefix) {
            return "descriptor " + id + " must set exactly one of filename or fileprefix";
        }
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
