package org.sagebionetworks.bridge.lock;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;

/**
 * Names the resource to lock. A key is also the owner of the lock: two keys created for the same resource are two
 * different owners and conflict with each other, even when they go through the same store. For that reason keys
 * use identity equality.
 */
public final class Key {

    private final String resource;

    public Key(final String resource) {
        checkArgument(!Strings.isNullOrEmpty(resource), "resource must be specified");
        this.resource = resource;
    }

    /** The name of the locked resource. */
    public String getResource() {
        return resource;
    }

    @Override
    public String toString() {
        return resource;
    }
}
