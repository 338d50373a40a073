package org.sagebionetworks.bridge.lock.exceptions;

/** Base class of the failures raised by lock stores and locks. */
@SuppressWarnings("serial")
public class LockException extends RuntimeException {
    public LockException() {
    }

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
