package com.baskettecase.credvault.connection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks which connection hashes are currently connected.
 *
 * Lives for the lifetime of the process only: a restart starts with nothing connected,
 * whatever is stored. Saving or deleting a credential never changes this state; only the
 * connection lifecycle does.
 */
@Slf4j
@Component
public class ConnectionStateTracker {

    private final Set<String> connected = new HashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void markConnected(String connectionHash) {
        if (connectionHash == null || connectionHash.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            connected.add(connectionHash);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Marked {} connected", connectionHash);
    }

    /**
     * Make this hash the only connected one, in a single step
     */
    public void replaceWith(String connectionHash) {
        if (connectionHash == null || connectionHash.isEmpty()) {
            clearAll();
            return;
        }
        lock.writeLock().lock();
        try {
            connected.clear();
            connected.add(connectionHash);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Marked {} as the only connection", connectionHash);
    }

    public void clear(String connectionHash) {
        lock.writeLock().lock();
        try {
            connected.remove(connectionHash);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forget every connection. A disconnect clears all tracked hashes, not just the latest.
     */
    public void clearAll() {
        int cleared;
        lock.writeLock().lock();
        try {
            cleared = connected.size();
            connected.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Cleared {} connected flag(s)", cleared);
    }

    public boolean isConnected(String connectionHash) {
        lock.readLock().lock();
        try {
            return connected.contains(connectionHash);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of the tracked hashes
     */
    public Set<String> connectedHashes() {
        lock.readLock().lock();
        try {
            return Set.copyOf(connected);
        } finally {
            lock.readLock().unlock();
        }
    }
}
