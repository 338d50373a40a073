package org.sagebionetworks.bridge.lock.jdbc;

/** The two modes of an advisory lock. */
public enum LockMode {
    /** At most one holder. */
    EXCLUSIVE,
    /** Any number of holders, excluding an exclusive holder. */
    SHARED
}
