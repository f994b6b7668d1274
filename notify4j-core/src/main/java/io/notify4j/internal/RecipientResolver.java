package io.notify4j.internal;

import io.notify4j.MembershipResolver;
import io.notify4j.core.AssignmentPolicy;
import io.notify4j.core.EventCandidate;
import io.notify4j.core.JobDefinition;
import io.notify4j.core.RecipientPolicy;
import io.notify4j.core.Roles;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns job assignment policies and rule recipient policies into concrete, active user ids.
 */
public class RecipientResolver {

    private final MembershipResolver membership;

    public RecipientResolver(MembershipResolver membership) {
        this.membership = Objects.requireNonNull(membership, "membership must not be null");
    }

    /**
     * <ul>
     *   <li>users: the fixed list, active only</li>
     *   <li>yacht_captain: captains of the job's yacht, else management and admins</li>
     *   <li>entity_owner: the fixed roles if they resolve to anyone, else captain and chief engineer</li>
     *   <li>roles: the fixed roles on the job's yacht, or globally without a yacht</li>
     * </ul>
     */
    public List<String> resolveAssignees(JobDefinition job) {
        AssignmentPolicy policy = job.assignmentPolicy() == null
                ? new AssignmentPolicy(null, null, null)
                : job.assignmentPolicy();
        String yachtId = job.yachtId();

        switch (policy.mode()) {
            case USERS:
                return activeUsers(policy.userIds());
            case YACHT_CAPTAIN: {
                List<String> captains = usersByRoles(List.of(Roles.CAPTAIN), yachtId);
                if (!captains.isEmpty()) {
                    return captains;
                }
                return usersByRoles(List.of(Roles.MANAGEMENT_OFFICE, Roles.ADMIN), yachtId);
            }
            case ENTITY_OWNER: {
                List<String> explicit = usersByRoles(policy.roles(), yachtId);
                if (!explicit.isEmpty()) {
                    return explicit;
                }
                return usersByRoles(List.of(Roles.CAPTAIN, Roles.CHIEF_ENGINEER), yachtId);
            }
            case ROLES:
            default:
                return usersByRoles(policy.roles(), yachtId);
        }
    }

    /**
     * <ul>
     *   <li>users: the fixed list, active only</li>
     *   <li>assignee: the candidate's assignee if active, else captain and management of the candidate's yacht</li>
     *   <li>role_then_escalate: assignee, then role users, then escalation role users, without duplicates</li>
     *   <li>roles: role users only</li>
     * </ul>
     */
    public List<String> resolveRecipients(RecipientPolicy policy, EventCandidate candidate) {
        RecipientPolicy p = policy == null ? new RecipientPolicy(null, null, null, null) : policy;
        String yachtId = candidate.yachtId();
        String assignee = candidate.assigneeUserId();

        switch (p.mode()) {
            case USERS:
                return activeUsers(p.userIds());
            case ASSIGNEE: {
                if (assignee != null && !assignee.isBlank()) {
                    List<String> active = activeUsers(List.of(assignee));
                    if (!active.isEmpty()) {
                        return active;
                    }
                }
                return usersByRoles(List.of(Roles.CAPTAIN, Roles.MANAGEMENT_OFFICE), yachtId);
            }
            case ROLE_THEN_ESCALATE: {
                Set<String> union = new LinkedHashSet<>();
                if (assignee != null && !assignee.isBlank()) {
                    union.addAll(activeUsers(List.of(assignee)));
                }
                union.addAll(usersByRoles(p.roles(), yachtId));
                union.addAll(usersByRoles(p.escalationRoles(), yachtId));
                return new ArrayList<>(union);
            }
            case ROLES:
            default:
                return usersByRoles(p.roles(), yachtId);
        }
    }

    private List<String> usersByRoles(Collection<String> roles, String yachtId) {
        if (roles == null || roles.isEmpty()) {
            return List.of();
        }
        List<String> users = membership.resolveUsersByRoles(roles, yachtId);
        return users == null ? List.of() : distinct(users);
    }

    private List<String> activeUsers(Collection<String> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        List<String> users = membership.filterActive(userIds);
        return users == null ? List.of() : distinct(users);
    }

    private static List<String> distinct(List<String> ids) {
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }
}
