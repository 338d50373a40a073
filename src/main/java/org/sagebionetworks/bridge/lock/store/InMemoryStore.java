package org.sagebionetworks.bridge.lock.store;

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.bridge.lock.Key;
import org.sagebionetworks.bridge.lock.exceptions.LockConflictedException;

/**
 * Lock store living in the memory of the current JVM. Locks never expire. Owners are compared by identity, so two
 * {@link Key} instances for the same resource conflict.
 * <p>
 * {@link AdvisoryLockStore} keeps one of these per connection to arbitrate between owners sharing a database
 * session, because the engine treats every owner of a session as the same holder.
 */
public class InMemoryStore implements SharedLockStore {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStore.class);

    private final Map<String, Key> locks = new HashMap<>();
    private final Map<String, Set<Key>> readLocks = new HashMap<>();

    @Override
    public synchronized void save(final Key key) {
        checkNotNull(key);
        final String resource = key.getResource();
        final Key owner = locks.get(resource);
        if (owner != null) {
            if (owner == key) {
                return;
            }
            throw new LockConflictedException(resource);
        }
        // Promotion is only allowed when the key is the sole reader
        final Set<Key> readers = readLocks.get(resource);
        if (readers != null && !(readers.size() == 1 && readers.contains(key))) {
            throw new LockConflictedException(resource);
        }
        locks.put(resource, key);
        readLocks.remove(resource);
        LOG.debug("Saved in-memory lock for {}.", resource);
    }

    @Override
    public synchronized void saveRead(final Key key) {
        checkNotNull(key);
        final String resource = key.getResource();
        final Set<Key> readers = readLocks.get(resource);
        if (readers != null) {
            readers.add(key);
            return;
        }
        // Demotion of the key's own exclusive lock
        final Key owner = locks.get(resource);
        if (owner != null && owner != key) {
            throw new LockConflictedException(resource);
        }
        final Set<Key> newReaders = Sets.newIdentityHashSet();
        newReaders.add(key);
        readLocks.put(resource, newReaders);
        locks.remove(resource);
        LOG.debug("Saved in-memory read lock for {}.", resource);
    }

    @Override
    public synchronized void delete(final Key key) {
        checkNotNull(key);
        final String resource = key.getResource();
        final Set<Key> readers = readLocks.get(resource);
        if (readers != null) {
            readers.remove(key);
            if (readers.isEmpty()) {
                readLocks.remove(resource);
            }
        }
        if (locks.get(resource) == key) {
            locks.remove(resource);
        }
    }

    @Override
    public synchronized boolean exists(final Key key) {
        checkNotNull(key);
        final String resource = key.getResource();
        final Set<Key> readers = readLocks.get(resource);
        return (readers != null && readers.contains(key)) || locks.get(resource) == key;
    }

    /** True if the key holds the exclusive lock. */
    synchronized boolean isWriter(final Key key) {
        return locks.get(key.getResource()) == key;
    }

    /** Memory locks never expire, there is nothing to extend. */
    @Override
    public void putOffExpiration(final Key key, final Duration ttl) {
        checkNotNull(key);
    }
}
