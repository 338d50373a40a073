package org.sagebionetworks.bridge.lock.store;

import org.sagebionetworks.bridge.lock.Key;

/** A store that can wait for a shared lock to become available. */
public interface BlockingSharedLockStore extends SharedLockStore {

    /** Waits until a shared lock is granted to the key. */
    void waitAndSaveRead(Key key);
}
