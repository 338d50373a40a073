package org.sagebionetworks.bridge.lock.config;

/** An environment variable or system property could not be read. */
@SuppressWarnings("serial")
public class ConfigReadException extends RuntimeException {

    public ConfigReadException(final String name, final Throwable cause) {
        super("Cannot read config entry '" + name + "'.", cause);
    }
}
