package org.sagebionetworks.bridge.lock.config;

/** Runtime environments. Config entries prefixed with the lower-case name apply only to that environment. */
public enum Environment {
    LOCAL,
    DEV,
    UAT,
    PROD
}
