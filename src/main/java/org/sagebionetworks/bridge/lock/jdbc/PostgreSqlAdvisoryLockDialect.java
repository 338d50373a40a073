package org.sagebionetworks.bridge.lock.jdbc;

import static com.google.common.base.Preconditions.checkNotNull;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * PostgreSQL advisory locks, using the single bigint key variant of the lock functions.
 * <p>
 * pg_locks splits a bigint key into classid (high 32 bits) and objid (low 32 bits), with objsubid set to 1.
 */
public class PostgreSqlAdvisoryLockDialect implements AdvisoryLockDialect {

    static final Set<String> DRIVER_NAMES = ImmutableSet.of("postgresql");

    private static final HashFunction HASH = Hashing.sha256();

    // Joins the bound lock id to the rows of pg_locks held by the current session
    private static final String SESSION_LOCKS = " FROM (SELECT ?::bigint AS id) k JOIN pg_locks l"
            + " ON l.locktype = 'advisory' AND l.objsubid = 1 AND l.pid = pg_backend_pid()"
            + " AND ((l.classid::bigint << 32) | l.objid::bigint) = k.id";

    static final String TRY_LOCK = "SELECT pg_try_advisory_lock(?)";
    static final String TRY_LOCK_SHARED = "SELECT pg_try_advisory_lock_shared(?)";
    static final String LOCK = "SELECT pg_advisory_lock(?)";
    static final String LOCK_SHARED = "SELECT pg_advisory_lock_shared(?)";
    static final String HELD_COUNT = "SELECT count(*)" + SESSION_LOCKS;
    static final String UNLOCK = "SELECT pg_advisory_unlock(k.id)" + SESSION_LOCKS
            + " WHERE l.mode = 'ExclusiveLock'";
    static final String UNLOCK_SHARED = "SELECT pg_advisory_unlock_shared(k.id)" + SESSION_LOCKS
            + " WHERE l.mode = 'ShareLock'";

    @Override
    public boolean supportsDriver(final String driverName) {
        return driverName != null && DRIVER_NAMES.contains(driverName.toLowerCase());
    }

    @Override
    public long toLockId(final String resource) {
        checkNotNull(resource);
        return HASH.hashString(resource, StandardCharsets.UTF_8).asLong();
    }

    @Override
    public String tryLockSql(final LockMode mode) {
        return mode == LockMode.SHARED ? TRY_LOCK_SHARED : TRY_LOCK;
    }

    @Override
    public String lockSql(final LockMode mode) {
        return mode == LockMode.SHARED ? LOCK_SHARED : LOCK;
    }

    @Override
    public String heldCountSql() {
        return HELD_COUNT;
    }

    @Override
    public String unlockSql(final LockMode mode) {
        return mode == LockMode.SHARED ? UNLOCK_SHARED : UNLOCK;
    }
}
