package org.sagebionetworks.bridge.lock.exceptions;

/** A lock could not be acquired for a reason other than contention. */
@SuppressWarnings("serial")
public class LockAcquiringException extends LockException {
    public LockAcquiringException(String message, Throwable cause) {
        super(message, cause);
    }
}
