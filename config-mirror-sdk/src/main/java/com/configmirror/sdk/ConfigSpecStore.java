package com.configmirror.sdk;

import com.configmirror.sdk.DataModel.ConfigSpec;

import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the current gates, dynamic configs and layer configs.
 * <p>
 * The three mappings, the last sync time and the init reason are always replaced together in one
 * write-locked section, so a reader never sees gates from one snapshot and configs from another.
 * The new mappings are built before the lock is taken; the write lock only covers the swap.
 */
final class ConfigSpecStore {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private SpecData data = SpecData.EMPTY;
    private long lastSyncTime = 0;
    private InitReason initReason = InitReason.UNINITIALIZED;

    private volatile long initialSyncTime = 0;

    /**
     * Returns the current snapshot's config data. All three kinds in the returned object come from
     * the same snapshot.
     */
    SpecData getData() {
        lock.readLock().lock();
        try {
            return data;
        } finally {
            lock.readLock().unlock();
        }
    }

    ConfigSpec get(ConfigKind kind, String name) {
        return getData().get(kind, name);
    }

    ConfigSpec getGate(String name) {
        return get(ConfigKind.GATE, name);
    }

    ConfigSpec getDynamicConfig(String name) {
        return get(ConfigKind.DYNAMIC_CONFIG, name);
    }

    ConfigSpec getLayerConfig(String name) {
        return get(ConfigKind.LAYER, name);
    }

    Set<String> getNames(ConfigKind kind) {
        return getData().names(kind);
    }

    /**
     * Replaces all config data with the contents of a snapshot received from the server.
     *
     * @param snapshot the snapshot
     * @return true if the snapshot had updates and was committed; false if the store is unchanged
     */
    boolean applySnapshot(ConfigSpecsResponse snapshot) {
        return commit(snapshot, InitReason.NETWORK);
    }

    /**
     * Same as {@link #applySnapshot(ConfigSpecsResponse)}, for data supplied by the application
     * rather than by the server.
     *
     * @param snapshot the bootstrap snapshot
     * @return true if the snapshot was committed
     */
    boolean applyBootstrap(ConfigSpecsResponse snapshot) {
        return commit(snapshot, InitReason.BOOTSTRAP);
    }

    private boolean commit(ConfigSpecsResponse snapshot, InitReason reason) {
        if (!snapshot.hasUpdates()) {
            return false;
        }
        SpecData newData = SpecData.fromResponse(snapshot);
        lock.writeLock().lock();
        try {
            data = newData;
            lastSyncTime = snapshot.getTime();
            initReason = reason;
        } finally {
            lock.writeLock().unlock();
        }
        return true;
    }

    long getLastSyncTime() {
        lock.readLock().lock();
        try {
            return lastSyncTime;
        } finally {
            lock.readLock().unlock();
        }
    }

    InitReason getInitReason() {
        lock.readLock().lock();
        try {
            return initReason;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records the current last sync time as the result of the initial synchronous sync.
     */
    void markInitialSync() {
        initialSyncTime = getLastSyncTime();
    }

    long getInitialSyncTime() {
        return initialSyncTime;
    }
}
