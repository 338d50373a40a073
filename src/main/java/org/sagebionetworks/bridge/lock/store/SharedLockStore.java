package org.sagebionetworks.bridge.lock.store;

import org.sagebionetworks.bridge.lock.Key;

/** A store that can also hand out shared (read) locks. */
public interface SharedLockStore extends PersistingStore {

    /**
     * Acquires a shared lock for the key. Any number of owners may hold a shared lock at the same time, but not
     * while an exclusive lock is held by someone else.
     *
     * @throws org.sagebionetworks.bridge.lock.exceptions.LockConflictedException
     *         if another owner holds the exclusive lock.
     */
    void saveRead(Key key);
}
