package org.sagebionetworks.bridge.lock.exceptions;

/** Misconfiguration, such as a store pointed at a database engine it cannot work with. Never retried. */
@SuppressWarnings("serial")
public class InvalidArgumentException extends IllegalArgumentException {
    public InvalidArgumentException(String message) {
        super(message);
    }
}
