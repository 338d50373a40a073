package org.sagebionetworks.bridge.lock.jdbc;

/**
 * SQL of a database engine that has session-scoped advisory locks. Only engines that really have the primitive get an
 * implementation; a store never emulates it with tables.
 * <p>
 * Every statement takes exactly one parameter, the lock id returned by {@link #toLockId}.
 */
public interface AdvisoryLockDialect {

    /**
     * True if connections opened through the given JDBC driver name (the URL subprotocol, such as "postgresql")
     * reach an engine this dialect works with.
     */
    boolean supportsDriver(String driverName);

    /** Maps a resource name to the numeric id the engine locks on. Must be the same in every JVM. */
    long toLockId(String resource);

    /** Query returning a single boolean: true if the lock was granted, false if it is held elsewhere. */
    String tryLockSql(LockMode mode);

    /** Query that waits until the lock is granted. */
    String lockSql(LockMode mode);

    /** Query returning a single count, greater than zero if the current session holds the lock in any mode. */
    String heldCountSql();

    /**
     * Query releasing one level of the lock held by the current session in the given mode. Returns one row if a
     * level was released, no row if the session does not hold the lock in that mode.
     */
    String unlockSql(LockMode mode);
}
