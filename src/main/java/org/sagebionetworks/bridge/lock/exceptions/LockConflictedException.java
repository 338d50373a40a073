package org.sagebionetworks.bridge.lock.exceptions;

/**
 * Thrown when the lock is held by someone else in an incompatible mode. Callers are expected to back off and try
 * again.
 */
@SuppressWarnings("serial")
public class LockConflictedException extends LockException {
    public LockConflictedException() {
    }

    public LockConflictedException(final String key) {
        super("Lock for " + key + " is not available.");
    }
}
