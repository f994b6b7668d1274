package io.notify4j.internal;

import io.notify4j.MembershipResolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role table keyed by (role, yachtId); a null yacht id is the global role.
 */
final class FakeMembership implements MembershipResolver {
    private final Map<String, List<String>> byRole = new LinkedHashMap<>();
    private final Set<String> inactive = new HashSet<>();
    private final Set<String> unreachableYachts = new HashSet<>();
    int roleLookups;

    FakeMembership member(String role, String yachtId, String... userIds) {
        byRole.computeIfAbsent(key(role, yachtId), k -> new ArrayList<>()).addAll(List.of(userIds));
        return this;
    }

    FakeMembership deactivate(String userId) {
        inactive.add(userId);
        return this;
    }

    FakeMembership failFor(String yachtId) {
        unreachableYachts.add(yachtId);
        return this;
    }

    @Override
    public List<String> resolveUsersByRoles(Collection<String> roles, String yachtId) {
        roleLookups++;
        if (unreachableYachts.contains(yachtId)) {
            throw new IllegalStateException("membership lookup failed for " + yachtId);
        }
        List<String> out = new ArrayList<>();
        for (String role : roles) {
            for (String u : byRole.getOrDefault(key(role, yachtId), List.of())) {
                if (!inactive.contains(u)) {
                    out.add(u);
                }
            }
        }
        return out;
    }

    @Override
    public List<String> filterActive(Collection<String> userIds) {
        List<String> out = new ArrayList<>();
        for (String u : userIds) {
            if (!inactive.contains(u)) {
                out.add(u);
            }
        }
        return out;
    }

    private static String key(String role, String yachtId) {
        return role + "@" + yachtId;
    }
}
