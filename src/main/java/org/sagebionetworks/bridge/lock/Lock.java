package org.sagebionetworks.bridge.lock;

import java.time.Duration;

/**
 * A lock on one resource, acquired and released through a lock store. Closing the lock releases it if it was
 * created with auto-release.
 */
public interface Lock extends AutoCloseable {

    /**
     * Tries to acquire the exclusive lock.
     *
     * @param blocking  If true, waits until the lock is available.
     * @return True, if the lock was acquired; false, if it is held by someone else and blocking is false.
     * @throws org.sagebionetworks.bridge.lock.exceptions.LockAcquiringException
     *         if the lock could not be acquired for another reason than contention.
     */
    boolean acquire(boolean blocking);

    /**
     * Tries to acquire a shared lock. Falls back to the exclusive lock if the store has no shared locks.
     *
     * @param blocking  If true, waits until the lock is available.
     * @return True, if the lock was acquired; false, if it is held by someone else and blocking is false.
     */
    boolean acquireRead(boolean blocking);

    /** Extends the lifetime of the lock by the ttl the lock was created with. */
    void refresh();

    /** Extends the lifetime of the lock by the given ttl. */
    void refresh(Duration ttl);

    /** Returns true if the lock is held by this lock's key. */
    boolean isAcquired();

    /**
     * Releases the lock.
     *
     * @throws org.sagebionetworks.bridge.lock.exceptions.LockReleasingException
     *         if the store failed, or still holds the lock afterwards.
     */
    void release();

    @Override
    void close();
}
