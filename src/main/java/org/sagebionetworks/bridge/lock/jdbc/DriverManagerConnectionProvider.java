package org.sagebionetworks.bridge.lock.jdbc;

import static com.google.common.base.Preconditions.checkNotNull;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Properties;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Opens connections with {@link DriverManager}.
 * <p>
 * Recognized options are {@link #DB_USERNAME} and {@link #DB_PASSWORD}. Any other option is handed to the driver as a
 * connection property.
 */
public class DriverManagerConnectionProvider implements ConnectionProvider {

    public static final String DB_USERNAME = "db_username";
    public static final String DB_PASSWORD = "db_password";

    private final String url;
    private final Map<String, String> options;

    public DriverManagerConnectionProvider(final String url, final Map<String, String> options) {
        checkNotNull(url);
        checkNotNull(options);
        this.url = url;
        this.options = ImmutableMap.copyOf(options);
    }

    public String getUrl() {
        return url;
    }

    @Override
    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(url, toProperties(options));
    }

    static Properties toProperties(final Map<String, String> options) {
        final Properties props = new Properties();
        for (Map.Entry<String, String> option : options.entrySet()) {
            if (DB_USERNAME.equals(option.getKey()) || DB_PASSWORD.equals(option.getKey())) {
                continue;
            }
            props.setProperty(option.getKey(), option.getValue());
        }
        // Either may be left out when the URL carries it
        final String username = options.get(DB_USERNAME);
        if (!Strings.isNullOrEmpty(username)) {
            props.setProperty("user", username);
        }
        final String password = options.get(DB_PASSWORD);
        if (password != null) {
            props.setProperty("password", password);
        }
        return props;
    }
}
