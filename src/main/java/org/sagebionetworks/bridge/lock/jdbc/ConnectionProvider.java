package org.sagebionetworks.bridge.lock.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/** Opens the connection a store keeps for its whole life. */
@FunctionalInterface
public interface ConnectionProvider {
    Connection openConnection() throws SQLException;
}
