package org.sagebionetworks.bridge.lock.store;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.sagebionetworks.bridge.lock.config.Config;
import org.sagebionetworks.bridge.lock.exceptions.InvalidArgumentException;
import org.sagebionetworks.bridge.lock.jdbc.DriverManagerConnectionProvider;
import org.sagebionetworks.bridge.lock.jdbc.JdbcUrls;
import org.sagebionetworks.bridge.lock.jdbc.PostgreSqlAdvisoryLockDialect;

/** Creates lock stores from connection strings. */
public final class StoreFactory {
    private static final Logger LOG = LoggerFactory.getLogger(StoreFactory.class);

    /** Connection string of the {@link InMemoryStore}. */
    public static final String IN_MEMORY = "in-memory";

    static final String DSN_KEY = "lock.store.dsn";
    static final String USERNAME_KEY = "lock.store.db_username";
    static final String PASSWORD_KEY = "lock.store.db_password";

    private static final PostgreSqlAdvisoryLockDialect POSTGRESQL = new PostgreSqlAdvisoryLockDialect();

    private StoreFactory() {
    }

    public static PersistingStore createStore(final String connection) {
        return createStore(connection, ImmutableMap.of());
    }

    /**
     * @param connection  {@link #IN_MEMORY}, or the JDBC URL of a database with advisory locks.
     * @param options     Connection options of a database store, ignored otherwise.
     * @throws InvalidArgumentException  if no store can handle the connection string.
     */
    public static PersistingStore createStore(final String connection, final Map<String, String> options) {
        checkNotNull(connection);
        checkNotNull(options);
        if (IN_MEMORY.equals(connection)) {
            return new InMemoryStore();
        }
        if (connection.startsWith("jdbc:") && POSTGRESQL.supportsDriver(JdbcUrls.driverName(connection))) {
            return new PostgreSqlStore(connection, options);
        }
        throw new InvalidArgumentException(String.format("Unsupported Connection: \"%s\".", connection));
    }

    /**
     * Creates the store described by the {@code lock.store.*} entries of the config.
     */
    public static PersistingStore createStore(final Config config) {
        checkNotNull(config);
        final String dsn = config.get(DSN_KEY);
        if (Strings.isNullOrEmpty(dsn)) {
            throw new InvalidArgumentException("Missing config entry " + DSN_KEY + ".");
        }
        final ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        final String username = config.get(USERNAME_KEY);
        if (!Strings.isNullOrEmpty(username)) {
            options.put(DriverManagerConnectionProvider.DB_USERNAME, username);
        }
        final String password = config.get(PASSWORD_KEY);
        if (password != null) {
            options.put(DriverManagerConnectionProvider.DB_PASSWORD, password);
        }
        LOG.info("Creating lock store for environment {}.", config.getEnvironment());
        return createStore(dsn, options.build());
    }
}
