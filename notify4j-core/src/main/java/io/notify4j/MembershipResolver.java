package io.notify4j;

import java.util.Collection;
import java.util.List;

/**
 * Role and yacht membership lookups supplied by the host application.
 *
 * <p>Implementations must return active users only. When a yacht id is given, only its active,
 * non-revoked memberships count and a per-yacht role override beats the user's global role.
 */
public interface MembershipResolver {

    /**
     * @param yachtId optional; {@code null} resolves against global roles
     */
    List<String> resolveUsersByRoles(Collection<String> roles, String yachtId);

    /**
     * Filter the given ids down to active users, preserving order.
     */
    List<String> filterActive(Collection<String> userIds);
}
