package com.di.skyflow.group;

public class GroupNotFoundException extends RuntimeException {

    public GroupNotFoundException(String groupId) {
        super("Observation group not found: " + groupId);
    }
}
