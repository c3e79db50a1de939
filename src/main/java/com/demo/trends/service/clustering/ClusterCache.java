package com.demo.trends.service.clustering;

import com.demo.trends.service.dto.ClusterRun;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-slot cache for cluster runs. A request for a different key recomputes and replaces the slot.
 * Check, compute and store happen under one lock, so an entry is only visible once fully built.
 */
@Slf4j
public class ClusterCache {

    public record Key(int nClusters, int sampleLimit) {}

    public record Entry(Key key, ClusterRun value) {}

    private final ReentrantLock lock = new ReentrantLock();
    private Entry slot;

    public ClusterRun getOrCompute(Key key, Supplier<ClusterRun> compute) {
        lock.lock();
        try {
            if (slot != null && slot.key().equals(key)) {
                log.debug("Cluster cache hit for {}", key);
                return slot.value();
            }
            ClusterRun run = compute.get();
            Entry fresh = new Entry(key, run);
            if (slot != null) {
                log.debug("Cluster cache evicting {} for {}", slot.key(), key);
            }
            slot = fresh;
            return run;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Entry> current() {
        lock.lock();
        try {
            return Optional.ofNullable(slot);
        } finally {
            lock.unlock();
        }
    }
}
