package com.di.datapipe.landing;

import com.di.datapipe.exception.TransientStageException;
import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Landing store backed by Google Cloud Storage. {@code storage.create} without preconditions
 * replaces an existing object, which is the overwrite semantics the pipeline relies on.
 */
@Slf4j
@RequiredArgsConstructor
public class GcsLandingStore implements LandingStore {

    private final Storage storage;

    @Override
    public void write(String bucket, String objectName, byte[] content, String contentType) {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, objectName))
                .setContentType(contentType)
                .build();
        try {
            storage.create(blobInfo, content);
        } catch (StorageException e) {
            throw new TransientStageException("Failed to write gs://" + bucket + "/" + objectName, e);
        }
        log.info("[LANDING] wrote {} bytes → gs://{}/{}", content.length, bucket, objectName);
    }

    @Override
    public Optional<byte[]> read(String bucket, String objectName) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, objectName));
            return blob == null ? Optional.empty() : Optional.of(blob.getContent());
        } catch (StorageException e) {
            throw new TransientStageException("Failed to read gs://" + bucket + "/" + objectName, e);
        }
    }

    @Override
    public List<String> list(String bucket, String prefix) {
        List<String> names = new ArrayList<>();
        try {
            Page<Blob> page = storage.list(bucket, Storage.BlobListOption.prefix(prefix == null ? "" : prefix));
            for (Blob blob : page.iterateAll()) {
                names.add(blob.getName());
            }
        } catch (StorageException e) {
            throw new TransientStageException("Failed to list gs://" + bucket + "/" + prefix, e);
        }
        Collections.sort(names);
        return names;
    }
}
