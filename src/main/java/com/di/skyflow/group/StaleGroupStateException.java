package com.di.skyflow.group;

/**
 * Another worker changed the group between read and write.
 */
public class StaleGroupStateException extends RuntimeException {

    public StaleGroupStateException(String groupId, long expectedVersion) {
        super("Group " + groupId + " was modified concurrently (expected version " + expectedVersion + ")");
    }
}
