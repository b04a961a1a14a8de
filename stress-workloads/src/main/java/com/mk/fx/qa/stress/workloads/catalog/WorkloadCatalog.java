package com.mk.fx.qa.stress.workloads.catalog;

import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.impl.CacheSweepWorkload;
import com.mk.fx.qa.stress.workloads.impl.FailingWorkload;
import com.mk.fx.qa.stress.workloads.impl.FloatingPointWorkload;
import com.mk.fx.qa.stress.workloads.impl.GamingWorkload;
import com.mk.fx.qa.stress.workloads.impl.HashingWorkload;
import com.mk.fx.qa.stress.workloads.impl.IntegerWorkload;
import com.mk.fx.qa.stress.workloads.impl.MemoryWorkload;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of selectable workloads keyed by numeric id.
 *
 * <p>{@link #defaultCatalog()} holds the built-in entries 1-8 and the unlisted self-test entry
 * {@value #SELF_TEST_ID}. Additional workloads are added with {@link #register}; lookups and
 * selection parsing never need to change for that.
 */
@Slf4j
public class WorkloadCatalog {

    /** Id of the workload that fails on purpose, used to check the harness itself. */
    public static final int SELF_TEST_ID = 102030;

    private final Map<Integer, WorkloadDescriptor> entries = new ConcurrentSkipListMap<>();

    public static WorkloadCatalog defaultCatalog() {
        var catalog = new WorkloadCatalog();
        catalog.register(1, "Integer arithmetic", IntegerWorkload::new);
        catalog.register(2, "Floating point arithmetic", FloatingPointWorkload::new);
        catalog.register(3, "Memory integrity", MemoryWorkload::new);
        catalog.register(4, "Cache sweep, 128-bit lanes", CacheSweepWorkload::narrowLanes);
        catalog.register(5, "Cache sweep, 256-bit lanes", CacheSweepWorkload::wideLanes);
        catalog.register(6, "Cache sweep, 256-bit fused multiply-add", CacheSweepWorkload::fusedWideLanes);
        catalog.register(7, "SHA-256/512 hashing", HashingWorkload::new);
        catalog.register(8, "Game-like mixed load", GamingWorkload::new);
        catalog.register(
                new WorkloadDescriptor(SELF_TEST_ID, "Intentionally failing self-test", false, FailingWorkload::new));
        return catalog;
    }

    public void register(int id, String displayName, Supplier<? extends Workload> factory) {
        register(new WorkloadDescriptor(id, displayName, true, factory));
    }

    /**
     * Adds an entry.
     *
     * @throws IllegalStateException if the id is already taken
     */
    public void register(WorkloadDescriptor descriptor) {
        var existing = entries.putIfAbsent(descriptor.id(), descriptor);
        if (existing != null) {
            throw new IllegalStateException(
                    "Workload id " + descriptor.id() + " already registered as '" + existing.displayName() + "'");
        }
    }

    public Optional<WorkloadDescriptor> find(int id) {
        return Optional.ofNullable(entries.get(id));
    }

    public boolean contains(int id) {
        return entries.containsKey(id);
    }

    /**
     * Creates a new instance of the workload registered under {@code id}.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public Workload create(int id) {
        return find(id)
                .map(WorkloadDescriptor::create)
                .orElseThrow(() -> new IllegalArgumentException("Unknown workload id: " + id));
    }

    /** Creates one fresh instance per id, in order. Unknown ids are rejected. */
    public List<Workload> createAll(List<Integer> ids) {
        List<Workload> workloads = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            workloads.add(create(id));
        }
        return workloads;
    }

    /**
     * Parses a comma or space separated list of ids such as {@code "1,2 7"}. Tokens that are not
     * numbers or not registered are skipped with a warning; order and duplicates are preserved.
     */
    public List<Integer> parseSelection(String input) {
        List<Integer> ids = new ArrayList<>();
        if (input == null || input.isBlank()) {
            return ids;
        }
        for (String token : input.trim().split("[,\\s]+")) {
            if (token.isEmpty()) {
                continue;
            }
            int id;
            try {
                id = Integer.parseInt(token);
            } catch (NumberFormatException e) {
                log.warn("Could not parse workload id '{}', skipping", token);
                continue;
            }
            if (!contains(id)) {
                log.warn("Workload {} does not exist, skipping", id);
                continue;
            }
            ids.add(id);
        }
        return ids;
    }

    /** Entries shown to users, ordered by id. */
    public List<WorkloadDescriptor> listed() {
        return entries.values().stream().filter(WorkloadDescriptor::listed).toList();
    }
}
