package io.notify4j.core;

/**
 * Breadth at which a rule applies: {@code fleet}, {@code yacht:<id>} or {@code entity:<type>/<id>},
 * the latter optionally yacht-qualified. Unset entity fields act as wildcards.
 */
public record RuleScope(ScopeType type, String yachtId, String entityType, String entityId) {

    public RuleScope {
        type = type == null ? ScopeType.FLEET : type;
    }

    public static RuleScope fleet() {
        return new RuleScope(ScopeType.FLEET, null, null, null);
    }

    public static RuleScope yacht(String yachtId) {
        return new RuleScope(ScopeType.YACHT, yachtId, null, null);
    }

    public static RuleScope entity(String yachtId, String entityType, String entityId) {
        return new RuleScope(ScopeType.ENTITY, yachtId, entityType, entityId);
    }

    public boolean matches(EventCandidate candidate) {
        return switch (type) {
            case FLEET -> true;
            case YACHT -> candidate.yachtId() != null && candidate.yachtId().equals(yachtId);
            case ENTITY -> wildcardEquals(yachtId, candidate.yachtId())
                    && wildcardEquals(entityType, candidate.entityType())
                    && wildcardEquals(entityId, candidate.entityId());
        };
    }

    private static boolean wildcardEquals(String expected, String actual) {
        if (expected == null || expected.isBlank()) {
            return true;
        }
        return expected.equals(actual);
    }
}
