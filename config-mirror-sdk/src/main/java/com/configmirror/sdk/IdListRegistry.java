package com.configmirror.sdk;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the current {@link IdList} for each list name. Independent of {@link ConfigSpecStore};
 * the two locks are never held together.
 */
final class IdListRegistry {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, IdList> lists = new HashMap<>();

    IdList get(String name) {
        lock.readLock().lock();
        try {
            return lists.get(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    void put(String name, IdList list) {
        lock.writeLock().lock();
        try {
            lists.put(name, list);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void remove(String name) {
        lock.writeLock().lock();
        try {
            lists.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a list only if it is still the given generation. A fetch task that finds corrupt
     * content uses this so that it cannot delete a newer generation put in place meanwhile.
     */
    boolean removeIfSame(String name, IdList expected) {
        lock.writeLock().lock();
        try {
            if (lists.get(name) != expected) {
                return false;
            }
            lists.remove(name);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Puts {@code replacement} in place of a list only if the list is still the given generation.
     */
    boolean replaceIfSame(String name, IdList expected, IdList replacement) {
        lock.writeLock().lock();
        try {
            if (lists.get(name) != expected) {
                return false;
            }
            lists.put(name, replacement);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the current list for the name, adding a placeholder first if there is none.
     */
    IdList getOrCreatePlaceholder(String name) {
        lock.writeLock().lock();
        try {
            return lists.computeIfAbsent(name, IdList::placeholder);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every list whose name is not in {@code names}.
     *
     * @return the names that were removed
     */
    List<String> retainOnly(Collection<String> names) {
        Set<String> keep = new HashSet<>(names);
        List<String> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (String name: new ArrayList<>(lists.keySet())) {
                if (!keep.contains(name)) {
                    lists.remove(name);
                    removed.add(name);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return removed;
    }

    Set<String> names() {
        lock.readLock().lock();
        try {
            return new HashSet<>(lists.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
}
