package com.flightcover.access;

import java.util.Arrays;
import java.util.Set;

/**
 * An already-authenticated caller and the capabilities it holds.
 */
public record Caller(String id, Set<Role> roles) {

    private static final Caller SYSTEM = new Caller("system", Set.of(Role.ADMIN));

    public Caller {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public static Caller of(String id, Role... roles) {
        return new Caller(id, Set.copyOf(Arrays.asList(roles)));
    }

    /** The in-process scheduler. */
    public static Caller system() {
        return SYSTEM;
    }

    public boolean hasAnyRole(Role... required) {
        for (Role role : required) {
            if (roles.contains(role)) {
                return true;
            }
        }
        return false;
    }
}
