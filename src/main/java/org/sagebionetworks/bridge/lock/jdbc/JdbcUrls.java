package org.sagebionetworks.bridge.lock.jdbc;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.base.Splitter;

/** Helpers for reading JDBC connection URLs. */
public final class JdbcUrls {

    private static final String JDBC_PREFIX = "jdbc:";
    private static final Splitter COLON_SPLITTER = Splitter.on(':').limit(2);

    private JdbcUrls() {
    }

    /**
     * Returns the subprotocol of a JDBC URL, "jdbc:postgresql://host/db" gives "postgresql". Returns an empty string
     * for anything that is not a JDBC URL, such as "pgsql:host=localhost", since no JDBC driver can open it.
     */
    public static String driverName(final String url) {
        checkNotNull(url);
        final String trimmed = url.trim();
        if (!trimmed.regionMatches(true, 0, JDBC_PREFIX, 0, JDBC_PREFIX.length())) {
            return "";
        }
        final String rest = trimmed.substring(JDBC_PREFIX.length());
        final List<String> parts = COLON_SPLITTER.splitToList(rest);
        if (parts.size() < 2) {
            return "";
        }
        return parts.get(0).toLowerCase();
    }
}
