package com.mk.fx.qa.stress.workloads.catalog;

import com.mk.fx.qa.stress.workloads.Workload;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Catalog entry binding a numeric id to a workload factory.
 *
 * @param id the number users select the workload with
 * @param displayName human readable description shown in listings
 * @param listed whether the entry is shown in the public listing
 * @param factory creates a fresh, unshared workload instance
 */
public record WorkloadDescriptor(
        int id, String displayName, boolean listed, Supplier<? extends Workload> factory) {

    public WorkloadDescriptor {
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(factory, "factory");
    }

    public Workload create() {
        return Objects.requireNonNull(factory.get(), "Workload factory returned null for id " + id);
    }
}
