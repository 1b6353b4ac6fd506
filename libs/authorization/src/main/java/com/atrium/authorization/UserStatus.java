package com.atrium.authorization;

/**
 * Lifecycle status of a user. Anything other than {@link #ACTIVE} is denied.
 */
public enum UserStatus {

    ACTIVE("active"),
    INACTIVE("inactive"),
    SUSPENDED("suspended");

    private final String value;

    UserStatus(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }
}
