package org.sagebionetworks.bridge.lock.config;

@SuppressWarnings("serial")
public class InvalidEnvironmentException extends RuntimeException {

    public InvalidEnvironmentException(final String envName) {
        super("Invalid environment '" + envName + "'.");
    }
}
