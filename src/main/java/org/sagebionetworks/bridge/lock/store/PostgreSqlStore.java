package org.sagebionetworks.bridge.lock.store;

import java.sql.Connection;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import org.sagebionetworks.bridge.lock.jdbc.ConnectionProvider;
import org.sagebionetworks.bridge.lock.jdbc.PostgreSqlAdvisoryLockDialect;

/**
 * Lock store using PostgreSQL advisory locks ({@code pg_try_advisory_lock} and friends). Any other database engine is
 * rejected with an {@link org.sagebionetworks.bridge.lock.exceptions.InvalidArgumentException} on first use.
 */
public class PostgreSqlStore extends AdvisoryLockStore {

    /** Creates a store for a JDBC URL that carries its own credentials, if any. */
    public PostgreSqlStore(final String url) {
        this(url, ImmutableMap.of());
    }

    /**
     * @param url      JDBC URL, for instance {@code jdbc:postgresql://localhost:5432/postgres}.
     * @param options  {@code db_username}, {@code db_password}, and extra driver properties.
     */
    public PostgreSqlStore(final String url, final Map<String, String> options) {
        super(new PostgreSqlAdvisoryLockDialect(), url, options);
    }

    /** Creates a store on a connection owned by the caller. */
    public PostgreSqlStore(final Connection connection) {
        super(new PostgreSqlAdvisoryLockDialect(), connection);
    }

    PostgreSqlStore(final String url, final ConnectionProvider provider) {
        super(new PostgreSqlAdvisoryLockDialect(), url, provider);
    }
}
