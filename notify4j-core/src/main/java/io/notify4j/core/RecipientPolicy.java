package io.notify4j.core;

import java.util.List;

public record RecipientPolicy(
        RecipientMode mode,
        List<String> roles,
        List<String> userIds,
        List<String> escalationRoles
) {
    public RecipientPolicy {
        mode = mode == null ? RecipientMode.ROLES : mode;
        roles = roles == null ? List.of() : List.copyOf(roles);
        userIds = userIds == null ? List.of() : List.copyOf(userIds);
        escalationRoles = escalationRoles == null ? List.of() : List.copyOf(escalationRoles);
    }

    public static RecipientPolicy ofRoles(String... roles) {
        return new RecipientPolicy(RecipientMode.ROLES, List.of(roles), null, null);
    }

    public static RecipientPolicy users(String... userIds) {
        return new RecipientPolicy(RecipientMode.USERS, null, List.of(userIds), null);
    }

    public static RecipientPolicy assignee() {
        return new RecipientPolicy(RecipientMode.ASSIGNEE, null, null, null);
    }
}
