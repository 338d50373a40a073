package org.sagebionetworks.bridge.lock.exceptions;

@SuppressWarnings("serial")
public class LockReleasingException extends LockException {
    public LockReleasingException(String message) {
        super(message);
    }

    public LockReleasingException(String message, Throwable cause) {
        super(message, cause);
    }
}
