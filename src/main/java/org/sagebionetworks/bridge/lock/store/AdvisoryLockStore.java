package org.sagebionetworks.bridge.lock.store;

import static com.google.common.base.Preconditions.checkNotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.MapMaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.bridge.lock.Key;
import org.sagebionetworks.bridge.lock.exceptions.InvalidArgumentException;
import org.sagebionetworks.bridge.lock.exceptions.LockConflictedException;
import org.sagebionetworks.bridge.lock.exceptions.LockStorageException;
import org.sagebionetworks.bridge.lock.jdbc.AdvisoryLockDialect;
import org.sagebionetworks.bridge.lock.jdbc.ConnectionProvider;
import org.sagebionetworks.bridge.lock.jdbc.DriverManagerConnectionProvider;
import org.sagebionetworks.bridge.lock.jdbc.JdbcUrls;
import org.sagebionetworks.bridge.lock.jdbc.LockMode;

/**
 * Lock store backed by the advisory locks of a relational database engine.
 * <p>
 * The engine does the arbitration: locks belong to the database session of the store's connection and are released
 * by the engine when that session ends, so nothing is ever written to a table and nothing needs to be cleaned up.
 * Acquisition uses the "try" variant of the engine functions and never waits, except in {@link #waitAndSave} and
 * {@link #waitAndSaveRead}.
 * <p>
 * {@link #exists} only reports locks held through this store's session. A lock held by another process reads as not
 * existing.
 * <p>
 * A store keeps a single connection and is not meant to be called from several threads at once.
 */
public class AdvisoryLockStore implements BlockingStore, BlockingSharedLockStore, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AdvisoryLockStore.class);

    // Owners sharing a session, keyed by connection identity
    private static final ConcurrentMap<Connection, InMemoryStore> SESSION_STORES = new MapMaker().weakKeys()
            .makeMap();

    private final AdvisoryLockDialect dialect;
    private final ConnectionProvider connectionProvider;
    private final String driverName;
    private final boolean ownsConnection;

    private Connection connection;
    private boolean driverChecked;
    private boolean closed;

    /**
     * Creates a store that opens its own connection on first use.
     *
     * @param dialect  SQL of the target engine.
     * @param url      JDBC URL of the database.
     * @param options  {@code db_username}, {@code db_password}, and extra driver properties.
     */
    public AdvisoryLockStore(final AdvisoryLockDialect dialect, final String url, final Map<String, String> options) {
        this(dialect, url, new DriverManagerConnectionProvider(url, options));
    }

    AdvisoryLockStore(final AdvisoryLockDialect dialect, final String url, final ConnectionProvider provider) {
        checkNotNull(dialect);
        checkNotNull(url);
        checkNotNull(provider);
        this.dialect = dialect;
        this.connectionProvider = provider;
        this.driverName = JdbcUrls.driverName(url);
        this.ownsConnection = true;
    }

    /**
     * Creates a store on an existing connection. The caller keeps ownership of the connection; closing it releases
     * every lock taken through this store.
     */
    public AdvisoryLockStore(final AdvisoryLockDialect dialect, final Connection connection) {
        checkNotNull(dialect);
        checkNotNull(connection);
        this.dialect = dialect;
        this.connectionProvider = null;
        this.driverName = null;
        this.ownsConnection = false;
        this.connection = connection;
    }

    @Override
    public void save(final Key key) {
        checkNotNull(key);
        checkDriver();
        final InMemoryStore sessionStore = getSessionStore();
        final boolean wasHeld = sessionStore.exists(key);
        final boolean wasWriter = sessionStore.isWriter(key);
        // Fails fast when another owner of this session holds the lock
        sessionStore.save(key);

        boolean acquired = false;
        try {
            acquired = tryLock(key, LockMode.EXCLUSIVE);
            if (acquired) {
                // Promotion: the shared level is not needed once the exclusive one is granted
                unlock(key, LockMode.SHARED);
            }
        } finally {
            if (!acquired) {
                restore(sessionStore, key, wasHeld, wasWriter);
            }
        }
        if (!acquired) {
            LOG.debug("Lock for {} is held by another session.", key);
            throw new LockConflictedException(key.getResource());
        }
        LOG.debug("Acquired advisory lock for {}.", key);
    }

    @Override
    public void saveRead(final Key key) {
        checkNotNull(key);
        checkDriver();
        final InMemoryStore sessionStore = getSessionStore();
        final boolean wasHeld = sessionStore.exists(key);
        final boolean wasWriter = sessionStore.isWriter(key);
        sessionStore.saveRead(key);

        boolean acquired = false;
        try {
            acquired = tryLock(key, LockMode.SHARED);
            if (acquired) {
                // Demotion
                unlock(key, LockMode.EXCLUSIVE);
            }
        } finally {
            if (!acquired) {
                restore(sessionStore, key, wasHeld, wasWriter);
            }
        }
        if (!acquired) {
            LOG.debug("Read lock for {} is blocked by another session.", key);
            throw new LockConflictedException(key.getResource());
        }
        LOG.debug("Acquired advisory read lock for {}.", key);
    }

    @Override
    public void waitAndSave(final Key key) {
        checkNotNull(key);
        checkDriver();
        final InMemoryStore sessionStore = getSessionStore();
        final boolean wasHeld = sessionStore.exists(key);
        final boolean wasWriter = sessionStore.isWriter(key);
        // An owner of this very session can not be waited for, fail instead
        sessionStore.save(key);

        boolean acquired = false;
        try {
            lock(key, LockMode.EXCLUSIVE);
            acquired = true;
        } finally {
            if (!acquired) {
                restore(sessionStore, key, wasHeld, wasWriter);
            }
        }
        unlock(key, LockMode.SHARED);
        LOG.debug("Acquired advisory lock for {} after waiting.", key);
    }

    @Override
    public void waitAndSaveRead(final Key key) {
        checkNotNull(key);
        checkDriver();
        final InMemoryStore sessionStore = getSessionStore();
        final boolean wasHeld = sessionStore.exists(key);
        final boolean wasWriter = sessionStore.isWriter(key);
        sessionStore.saveRead(key);

        boolean acquired = false;
        try {
            lock(key, LockMode.SHARED);
            acquired = true;
        } finally {
            if (!acquired) {
                restore(sessionStore, key, wasHeld, wasWriter);
            }
        }
        unlock(key, LockMode.EXCLUSIVE);
        LOG.debug("Acquired advisory read lock for {} after waiting.", key);
    }

    @Override
    public void delete(final Key key) {
        checkNotNull(key);
        // Locks of other owners sharing this session must survive
        if (!exists(key)) {
            return;
        }
        unlock(key, LockMode.EXCLUSIVE);

        // The shared level is released only when no other owner of this session still reads
        final InMemoryStore sessionStore = getSessionStore();
        try {
            sessionStore.save(key);
            unlock(key, LockMode.SHARED);
        } catch (LockConflictedException e) {
            LOG.debug("Read lock for {} is kept for the other readers of the session.", key);
        }
        sessionStore.delete(key);
        LOG.debug("Released advisory lock for {}.", key);
    }

    @Override
    public boolean exists(final Key key) {
        checkNotNull(key);
        checkDriver();
        final InMemoryStore sessionStore = getSessionStore();
        final long held = execute(dialect.heldCountSql(), key, resultSet -> {
            resultSet.next();
            return resultSet.getLong(1);
        });
        if (held > 0) {
            return sessionStore.exists(key);
        }
        if (sessionStore.exists(key)) {
            LOG.warn("Advisory lock for {} is no longer held by the session.", key);
            sessionStore.delete(key);
        }
        return false;
    }

    /**
     * Advisory locks live as long as the session and have no expiration to extend. This only checks that the key
     * still holds the lock.
     */
    @Override
    public void putOffExpiration(final Key key, final Duration ttl) {
        checkNotNull(key);
        if (!exists(key)) {
            throw new LockConflictedException(key.getResource());
        }
    }

    /**
     * Closes the connection this store opened, which makes the engine release every lock of the session. A
     * connection passed in by the caller is left open.
     */
    @Override
    public void close() {
        if (!ownsConnection || closed) {
            return;
        }
        closed = true;
        if (connection == null) {
            return;
        }
        SESSION_STORES.remove(connection);
        try {
            connection.close();
        } catch (SQLException e) {
            throw new LockStorageException("Failed to close the connection of the lock store.", e);
        } finally {
            connection = null;
        }
    }

    // Puts the owner back in the state it had before a failed acquisition
    private void restore(final InMemoryStore sessionStore, final Key key, final boolean wasHeld,
            final boolean wasWriter) {
        sessionStore.delete(key);
        if (wasWriter) {
            sessionStore.save(key);
        } else if (wasHeld) {
            sessionStore.saveRead(key);
        }
    }

    private boolean tryLock(final Key key, final LockMode mode) {
        return execute(dialect.tryLockSql(mode), key, resultSet -> resultSet.next() && resultSet.getBoolean(1));
    }

    private void lock(final Key key, final LockMode mode) {
        execute(dialect.lockSql(mode), key, ResultSet::next);
    }

    // Advisory locks are re-entrant, every level has to be released
    private void unlock(final Key key, final LockMode mode) {
        final String sql = dialect.unlockSql(mode);
        while (execute(sql, key, ResultSet::next)) {
            LOG.trace("Released one {} level of {}.", mode, key);
        }
    }

    private void checkDriver() {
        if (driverChecked) {
            return;
        }
        final String driver = driverName != null ? driverName : JdbcUrls.driverName(connectionUrl());
        if (!dialect.supportsDriver(driver)) {
            throw new InvalidArgumentException(String.format("The adapter \"%s\" does not support the \"%s\" driver.",
                    getClass().getName(), driver));
        }
        driverChecked = true;
    }

    private String connectionUrl() {
        try {
            return getConnection().getMetaData().getURL();
        } catch (SQLException e) {
            throw new LockStorageException("Failed to read the metadata of the lock store connection.", e);
        }
    }

    private InMemoryStore getSessionStore() {
        return SESSION_STORES.computeIfAbsent(getConnection(), c -> new InMemoryStore());
    }

    // Never re-opened: a new session would not hold the locks of the old one
    private Connection getConnection() {
        if (closed) {
            throw new LockStorageException("The lock store is closed.");
        }
        if (connection == null) {
            try {
                connection = connectionProvider.openConnection();
            } catch (SQLException e) {
                throw new LockStorageException("Failed to open the connection of the lock store.", e);
            }
            LOG.debug("Opened lock store connection for driver {}.", driverName);
            return connection;
        }
        try {
            if (connection.isClosed()) {
                throw new LockStorageException(
                        "The connection of the lock store is closed, the locks of its session are released.");
            }
        } catch (SQLException e) {
            throw new LockStorageException("Failed to check the connection of the lock store.", e);
        }
        return connection;
    }

    private <T> T execute(final String sql, final Key key, final ResultReader<T> reader) {
        try (PreparedStatement statement = getConnection().prepareStatement(sql)) {
            statement.setLong(1, dialect.toLockId(key.getResource()));
            try (ResultSet resultSet = statement.executeQuery()) {
                return reader.read(resultSet);
            }
        } catch (SQLException e) {
            LOG.warn("Lock statement failed for {}: {}", key, e.getMessage());
            throw new LockStorageException("Failed to execute the lock statement for " + key + ".", e);
        }
    }

    @FunctionalInterface
    private interface ResultReader<T> {
        T read(ResultSet resultSet) throws SQLException;
    }
}
