package org.sagebionetworks.bridge.lock.exceptions;

/**
 * The backing store could not be reached or rejected a statement. Once this is thrown the caller must assume that
 * every lock held through the failing session is gone.
 */
@SuppressWarnings("serial")
public class LockStorageException extends LockException {
    public LockStorageException(String message) {
        super(message);
    }

    public LockStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
