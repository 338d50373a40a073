package org.sagebionetworks.bridge.lock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.bridge.lock.config.Config;
import org.sagebionetworks.bridge.lock.store.PersistingStore;

/** Creates locks backed by one store. */
public class LockFactory {
    private static final Logger LOG = LoggerFactory.getLogger(LockFactory.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_RETRY_DELAY_MILLIS = 100;

    static final String RETRY_DELAY_KEY = "lock.retry.delay.millis";

    private final PersistingStore store;
    private final int retryDelayMillis;

    public LockFactory(final PersistingStore store) {
        this(store, DEFAULT_RETRY_DELAY_MILLIS);
    }

    /** Reads the retry delay of blocking acquisitions from {@code lock.retry.delay.millis}. */
    public LockFactory(final PersistingStore store, final Config config) {
        this(store, checkNotNull(config).getInt(RETRY_DELAY_KEY, DEFAULT_RETRY_DELAY_MILLIS));
    }

    public LockFactory(final PersistingStore store, final int retryDelayMillis) {
        checkNotNull(store);
        checkArgument(retryDelayMillis > StoreLock.RETRY_JITTER_MILLIS, "retry delay must be greater than %s ms",
                StoreLock.RETRY_JITTER_MILLIS);
        this.store = store;
        this.retryDelayMillis = retryDelayMillis;
    }

    /** Creates an auto-released lock with the default ttl. */
    public Lock createLock(final String resource) {
        return createLock(resource, DEFAULT_TTL, true);
    }

    /**
     * @param resource     Name of the resource to lock.
     * @param ttl          Lifetime of the lock, or null for no expiration.
     * @param autoRelease  Whether closing the lock releases it.
     */
    public Lock createLock(final String resource, final Duration ttl, final boolean autoRelease) {
        return createLockFromKey(new Key(resource), ttl, autoRelease);
    }

    /** Creates a lock for an existing key, for instance one handed over by another lock. */
    public Lock createLockFromKey(final Key key, final Duration ttl, final boolean autoRelease) {
        LOG.debug("Creating lock for \"{}\".", key);
        return new StoreLock(key, store, ttl, autoRelease, retryDelayMillis);
    }
}
