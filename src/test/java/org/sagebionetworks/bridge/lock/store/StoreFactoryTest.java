package org.sagebionetworks.bridge.lock.store;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.io.IOException;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

import org.sagebionetworks.bridge.lock.config.Config;
import org.sagebionetworks.bridge.lock.config.PropertiesConfig;
import org.sagebionetworks.bridge.lock.exceptions.InvalidArgumentException;

public class StoreFactoryTest {

    @AfterMethod
    public void after() {
        System.clearProperty(StoreFactory.DSN_KEY);
    }

    @Test
    public void testInMemory() {
        assertTrue(StoreFactory.createStore(StoreFactory.IN_MEMORY) instanceof InMemoryStore);
    }

    @Test
    public void testPostgreSql() {
        // Connections are opened lazily, nothing is reached here
        assertTrue(StoreFactory.createStore("jdbc:postgresql://localhost:5432/postgres") instanceof PostgreSqlStore);
    }

    @Test
    public void testPgsqlSubprotocolIsUnsupported() {
        // The PostgreSQL driver only registers jdbc:postgresql:
        try {
            StoreFactory.createStore("jdbc:pgsql://localhost:5432/postgres");
            fail("InvalidArgumentException expected.");
        } catch (InvalidArgumentException e) {
            assertEquals(e.getMessage(), "Unsupported Connection: \"jdbc:pgsql://localhost:5432/postgres\".");
        }
    }

    @Test
    public void testUnsupportedConnection() {
        try {
            StoreFactory.createStore("jdbc:sqlite:/tmp/foo.db");
            fail("InvalidArgumentException expected.");
        } catch (InvalidArgumentException e) {
            assertEquals(e.getMessage(), "Unsupported Connection: \"jdbc:sqlite:/tmp/foo.db\".");
        }
    }

    @Test(expectedExceptions = InvalidArgumentException.class)
    public void testConnectionStringWithoutJdbcPrefix() {
        StoreFactory.createStore("postgresql://localhost/postgres");
    }

    @Test
    public void testFromConfig() throws IOException {
        Config config = new PropertiesConfig("conf/lock.conf");
        assertTrue(StoreFactory.createStore(config) instanceof InMemoryStore);
    }

    @Test
    public void testFromConfigWithDatabase() throws IOException {
        System.setProperty(StoreFactory.DSN_KEY, "jdbc:postgresql://localhost:5432/postgres");
        Config config = new PropertiesConfig("conf/lock.conf");
        assertTrue(StoreFactory.createStore(config) instanceof PostgreSqlStore);
    }

    @Test(expectedExceptions = InvalidArgumentException.class,
            expectedExceptionsMessageRegExp = "Missing config entry lock.store.dsn.")
    public void testFromConfigWithoutDsn() throws IOException {
        System.setProperty(StoreFactory.DSN_KEY, "");
        StoreFactory.createStore(new PropertiesConfig("conf/lock.conf"));
    }
}
