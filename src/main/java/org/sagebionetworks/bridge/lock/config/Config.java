package org.sagebionetworks.bridge.lock.config;

import java.util.List;

public interface Config {

    /** Gets the runtime environment. */
    Environment getEnvironment();

    /**
     * Gets the value of a config entry, or null if there is none.
     * Do not include the "&lt;environment&gt;." prefix for the key.
     */
    String get(String key);

    /** Gets the value of a config entry as an integer. */
    int getInt(String key);

    /** Gets the value of a config entry as an integer, or the default value if there is no such entry. */
    int getInt(String key, int defaultValue);

    /** Gets the value of a config entry as a list. */
    List<String> getList(String key);
}
