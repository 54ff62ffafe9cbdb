package com.di.datapipe.warehouse;

import com.di.datapipe.security.AccessPolicy;
import com.di.datapipe.security.Permission;
import com.di.datapipe.security.StageIdentity;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Warehouse bound to a stage identity. Loads and queries need write access to the dataset;
 * queries and row counts also need read access.
 */
@RequiredArgsConstructor
public class GuardedWarehouse implements Warehouse {

    private final Warehouse delegate;
    private final StageIdentity identity;
    private final AccessPolicy policy;

    @Override
    public JobResult runLoad(LoadJobSpec spec) {
        policy.require(identity, Permission.WAREHOUSE_WRITE, "table " + spec.getTable());
        return delegate.runLoad(spec);
    }

    @Override
    public JobResult runQuery(QueryJobSpec spec) {
        policy.require(identity, Permission.WAREHOUSE_READ, "query " + spec.getJobId());
        policy.require(identity, Permission.WAREHOUSE_WRITE, "table " + spec.getDestinationTable());
        return delegate.runQuery(spec);
    }

    @Override
    public Optional<Long> rowCount(String table) {
        policy.require(identity, Permission.WAREHOUSE_READ, "table " + table);
        return delegate.rowCount(table);
    }
}
