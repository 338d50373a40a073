package org.sagebionetworks.bridge.lock.store;

import java.time.Duration;

import org.sagebionetworks.bridge.lock.Key;

/**
 * Stores exclusive locks. Implementations never block in {@link #save}: either the lock is granted right away or
 * the call fails.
 */
public interface PersistingStore {

    /**
     * Acquires the exclusive lock for the key.
     *
     * @param key  The key to lock on. The key instance is the owner of the lock.
     * @throws org.sagebionetworks.bridge.lock.exceptions.LockConflictedException
     *         if the lock is already held by another owner.
     */
    void save(Key key);

    /**
     * Releases the lock held by the key, whatever its mode. Releasing a lock the key does not hold does nothing.
     */
    void delete(Key key);

    /**
     * Returns true if the key holds the lock through this store. This is not a global check: a lock held by
     * another process, or by another store, is reported as not existing.
     */
    boolean exists(Key key);

    /**
     * Extends the lifetime of a held lock.
     *
     * @param key  The key holding the lock.
     * @param ttl  The new lifetime of the lock.
     * @throws org.sagebionetworks.bridge.lock.exceptions.LockConflictedException
     *         if the key no longer holds the lock.
     */
    void putOffExpiration(Key key, Duration ttl);
}
