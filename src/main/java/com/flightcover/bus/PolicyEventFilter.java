package com.flightcover.bus;

/**
 * Selects notifications by policy, holder and type. A null component
 * matches everything.
 */
public record PolicyEventFilter(Long policyId, String holder, PolicyEventType type) {

    private static final PolicyEventFilter ALL = new PolicyEventFilter(null, null, null);

    public static PolicyEventFilter all() {
        return ALL;
    }

    public static PolicyEventFilter forPolicy(long policyId) {
        return new PolicyEventFilter(policyId, null, null);
    }

    public PolicyEventFilter withType(PolicyEventType eventType) {
        return new PolicyEventFilter(policyId, holder, eventType);
    }

    public boolean matches(PolicyEvent event) {
        return (policyId == null || policyId.equals(event.policyId()))
            && (holder == null || holder.equals(event.holder()))
            && (type == null || type == event.type());
    }
}
