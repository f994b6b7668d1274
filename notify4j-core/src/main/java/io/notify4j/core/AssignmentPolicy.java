package io.notify4j.core;

import java.util.List;

/**
 * Persisted as {@code {mode, roles[], userIds[]}}.
 */
public record AssignmentPolicy(AssignmentMode mode, List<String> roles, List<String> userIds) {

    public AssignmentPolicy {
        mode = mode == null ? AssignmentMode.ROLES : mode;
        roles = roles == null ? List.of() : List.copyOf(roles);
        userIds = userIds == null ? List.of() : List.copyOf(userIds);
    }

    public static AssignmentPolicy users(String... userIds) {
        return new AssignmentPolicy(AssignmentMode.USERS, List.of(), List.of(userIds));
    }

    public static AssignmentPolicy ofRoles(String... roles) {
        return new AssignmentPolicy(AssignmentMode.ROLES, List.of(roles), List.of());
    }
}
