package com.di.datapipe.landing;

import com.di.datapipe.security.AccessPolicy;
import com.di.datapipe.security.Permission;
import com.di.datapipe.security.StageIdentity;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Binds a landing store to the identity of the stage using it and enforces that identity's grants
 * before delegating.
 */
@RequiredArgsConstructor
public class GuardedLandingStore implements LandingStore {

    private final LandingStore delegate;
    private final StageIdentity identity;
    private final AccessPolicy policy;

    @Override
    public void write(String bucket, String objectName, byte[] content, String contentType) {
        policy.require(identity, Permission.LANDING_WRITE, "gs://" + bucket + "/" + objectName);
        delegate.write(bucket, objectName, content, contentType);
    }

    @Override
    public Optional<byte[]> read(String bucket, String objectName) {
        policy.require(identity, Permission.LANDING_READ, "gs://" + bucket + "/" + objectName);
        return delegate.read(bucket, objectName);
    }

    @Override
    public List<String> list(String bucket, String prefix) {
        policy.require(identity, Permission.LANDING_READ, "gs://" + bucket + "/" + prefix);
        return delegate.list(bucket, prefix);
    }
}
