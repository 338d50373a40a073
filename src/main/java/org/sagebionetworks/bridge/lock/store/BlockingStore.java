package org.sagebionetworks.bridge.lock.store;

import org.sagebionetworks.bridge.lock.Key;

/** A store that can wait for an exclusive lock to become available. */
public interface BlockingStore extends PersistingStore {

    /** Waits until the exclusive lock is granted to the key. */
    void waitAndSave(Key key);
}
