package io.notify4j.core;

/**
 * Role names used by the built-in recipient fallbacks.
 */
public final class Roles {

    public static final String CAPTAIN = "Captain";
    public static final String MANAGEMENT_OFFICE = "Management/Office";
    public static final String ADMIN = "Admin";
    public static final String CHIEF_ENGINEER = "Chief Engineer";

    private Roles() {
    }
}
