package org.sagebionetworks.bridge.lock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.bridge.lock.exceptions.InvalidArgumentException;
import org.sagebionetworks.bridge.lock.exceptions.LockAcquiringException;
import org.sagebionetworks.bridge.lock.exceptions.LockConflictedException;
import org.sagebionetworks.bridge.lock.exceptions.LockReleasingException;
import org.sagebionetworks.bridge.lock.store.BlockingSharedLockStore;
import org.sagebionetworks.bridge.lock.store.BlockingStore;
import org.sagebionetworks.bridge.lock.store.PersistingStore;
import org.sagebionetworks.bridge.lock.store.SharedLockStore;

/**
 * {@link Lock} on top of a {@link PersistingStore}. Not thread safe; each thread should use its own lock.
 */
public class StoreLock implements Lock {
    private static final Logger LOG = LoggerFactory.getLogger(StoreLock.class);

    // Spread of the retry delay, so that waiting processes do not retry in lockstep
    static final int RETRY_JITTER_MILLIS = 10;

    private final Key key;
    private final PersistingStore store;
    private final Duration ttl;
    private final boolean autoRelease;
    private final int retryDelayMillis;

    private boolean dirty;

    /**
     * @param key               Resource and owner of the lock.
     * @param store             Store holding the lock.
     * @param ttl               Lifetime of the lock, or null for no expiration.
     * @param autoRelease       If true, {@link #close()} releases the lock.
     * @param retryDelayMillis  Pause between attempts of a blocking acquire on a store that can not wait.
     */
    public StoreLock(final Key key, final PersistingStore store, final Duration ttl, final boolean autoRelease,
            final int retryDelayMillis) {
        checkNotNull(key);
        checkNotNull(store);
        checkArgument(retryDelayMillis > RETRY_JITTER_MILLIS, "retry delay must be greater than %s ms",
                RETRY_JITTER_MILLIS);
        this.key = key;
        this.store = store;
        this.ttl = ttl;
        this.autoRelease = autoRelease;
        this.retryDelayMillis = retryDelayMillis;
    }

    @Override
    public boolean acquire(final boolean blocking) {
        try {
            if (!blocking) {
                store.save(key);
            } else if (store instanceof BlockingStore) {
                ((BlockingStore) store).waitAndSave(key);
            } else {
                retryUntilSaved(() -> store.save(key));
            }
            dirty = true;
            LOG.debug("Successfully acquired the \"{}\" lock.", key);
            if (ttl != null) {
                refresh();
            }
            return true;
        } catch (LockConflictedException e) {
            dirty = false;
            LOG.info("Failed to acquire the \"{}\" lock. Someone else already acquired the lock.", key);
            if (blocking) {
                throw e;
            }
            return false;
        } catch (InvalidArgumentException | LockAcquiringException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Failed to acquire the \"" + key + "\" lock.", e);
            throw new LockAcquiringException("Failed to acquire the \"" + key + "\" lock.", e);
        }
    }

    @Override
    public boolean acquireRead(final boolean blocking) {
        if (!(store instanceof SharedLockStore)) {
            LOG.debug("Store does not support read locks, falling back to an exclusive lock for \"{}\".", key);
            return acquire(blocking);
        }
        final SharedLockStore sharedStore = (SharedLockStore) store;
        try {
            if (!blocking) {
                sharedStore.saveRead(key);
            } else if (sharedStore instanceof BlockingSharedLockStore) {
                ((BlockingSharedLockStore) sharedStore).waitAndSaveRead(key);
            } else {
                retryUntilSaved(() -> sharedStore.saveRead(key));
            }
            dirty = true;
            LOG.debug("Successfully acquired the \"{}\" lock for reading.", key);
            if (ttl != null) {
                refresh();
            }
            return true;
        } catch (LockConflictedException e) {
            dirty = false;
            LOG.info("Failed to acquire the \"{}\" lock for reading. Someone else already acquired the lock.", key);
            if (blocking) {
                throw e;
            }
            return false;
        } catch (InvalidArgumentException | LockAcquiringException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Failed to acquire the \"" + key + "\" lock for reading.", e);
            throw new LockAcquiringException("Failed to acquire the \"" + key + "\" lock for reading.", e);
        }
    }

    @Override
    public void refresh() {
        refresh(ttl);
    }

    @Override
    public void refresh(final Duration ttl) {
        if (ttl == null) {
            throw new InvalidArgumentException("You have to define an expiration duration.");
        }
        try {
            store.putOffExpiration(key, ttl);
            dirty = true;
            LOG.debug("Expiration defined for \"{}\" lock for {} seconds.", key, ttl.getSeconds());
        } catch (LockConflictedException e) {
            dirty = false;
            LOG.info("Failed to define an expiration for the \"{}\" lock, someone else acquired the lock.", key);
            throw e;
        } catch (InvalidArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Failed to define an expiration for the \"" + key + "\" lock.", e);
            throw new LockAcquiringException("Failed to define an expiration for the \"" + key + "\" lock.", e);
        }
    }

    @Override
    public boolean isAcquired() {
        dirty = store.exists(key);
        return dirty;
    }

    @Override
    public void release() {
        try {
            store.delete(key);
            dirty = false;
        } catch (RuntimeException e) {
            LOG.warn("Failed to release the \"" + key + "\" lock.", e);
            throw new LockReleasingException("Failed to release the \"" + key + "\" lock.", e);
        }
        if (store.exists(key)) {
            LOG.warn("Failed to release the \"{}\" lock, the resource is still locked.", key);
            throw new LockReleasingException(
                    "Failed to release the \"" + key + "\" lock, the resource is still locked.");
        }
        LOG.debug("Successfully released the \"{}\" lock.", key);
    }

    /** Releases the lock if it was created with auto-release and is still held. */
    @Override
    public void close() {
        if (autoRelease && dirty && isAcquired()) {
            release();
        }
    }

    /** The key of this lock. */
    public Key getKey() {
        return key;
    }

    private void retryUntilSaved(final Runnable save) {
        while (true) {
            try {
                save.run();
                return;
            } catch (LockConflictedException e) {
                LOG.trace("Lock \"{}\" is busy, retrying.", key);
            }
            final int jitter = ThreadLocalRandom.current().nextInt(-RETRY_JITTER_MILLIS, RETRY_JITTER_MILLIS + 1);
            try {
                Thread.sleep(retryDelayMillis + jitter);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new LockAcquiringException("Interrupted while waiting for the \"" + key + "\" lock.", ex);
            }
        }
    }
}
