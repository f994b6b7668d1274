package io.notify4j.core;

/**
 * How the users executing a job are computed.
 */
public enum AssignmentMode {
    /** Fixed role list resolved against yacht membership (or globally without a yacht). */
    ROLES,
    /** Fixed user list, filtered to active users. */
    USERS,
    /** Explicit roles when they resolve to someone, else Captain and Chief Engineer. */
    ENTITY_OWNER,
    /** Yacht captain(s), else Management/Office and Admin. */
    YACHT_CAPTAIN
}
