package io.notify4j.core;

/**
 * How the recipients of a rule notification are computed.
 */
public enum RecipientMode {
    ROLES,
    USERS,
    ASSIGNEE,
    ROLE_THEN_ESCALATE
}
