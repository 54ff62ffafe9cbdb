package com.di.datapipe.security;

import com.di.datapipe.exception.PermissionDeniedException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Least-privilege grants per stage identity.
 *
 * <pre>
 *   SCHEDULER  publish trigger topic
 *   INGESTION  write landing store, publish notification topic
 *   LOADER     read landing store, read/write warehouse dataset
 * </pre>
 *
 * The ingestion and loader grants are disjoint; neither identity may perform the other's operations.
 */
@Slf4j
public final class AccessPolicy {

    private final Map<StageIdentity, Set<Permission>> grants;

    private AccessPolicy(Map<StageIdentity, Set<Permission>> grants) {
        this.grants = grants;
    }

    public static AccessPolicy leastPrivilege() {
        Map<StageIdentity, Set<Permission>> grants = new EnumMap<>(StageIdentity.class);
        grants.put(StageIdentity.SCHEDULER, Collections.unmodifiableSet(EnumSet.of(Permission.TRIGGER_PUBLISH)));
        grants.put(StageIdentity.INGESTION, Collections.unmodifiableSet(
                EnumSet.of(Permission.LANDING_WRITE, Permission.NOTIFICATION_PUBLISH)));
        grants.put(StageIdentity.LOADER, Collections.unmodifiableSet(
                EnumSet.of(Permission.LANDING_READ, Permission.WAREHOUSE_READ, Permission.WAREHOUSE_WRITE)));
        return new AccessPolicy(Collections.unmodifiableMap(grants));
    }

    public boolean isGranted(StageIdentity identity, Permission permission) {
        Set<Permission> granted = grants.get(identity);
        return granted != null && granted.contains(permission);
    }

    /**
     * @throws PermissionDeniedException when {@code identity} lacks {@code permission}
     */
    public void require(StageIdentity identity, Permission permission, String resource) {
        if (!isGranted(identity, permission)) {
            log.error("[ACCESS] denied identity={} permission={} resource={}", identity, permission, resource);
            throw new PermissionDeniedException(
                    "Identity " + identity + " lacks " + permission + " on " + resource);
        }
    }

    public Set<Permission> grantsOf(StageIdentity identity) {
        return grants.getOrDefault(identity, Set.of());
    }
}
