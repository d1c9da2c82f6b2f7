package com.flightcover.api;

import com.flightcover.access.Caller;
import com.flightcover.access.Role;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the {@link Caller} from headers set by the authenticating gateway
 * in front of this service.
 */
final class CallerHeaders {

    static final String CALLER_ID = "X-Caller-Id";
    static final String CALLER_ROLES = "X-Caller-Roles";

    private CallerHeaders() {
    }

    static Caller resolve(String callerId, String roles) {
        String id = callerId == null || callerId.isBlank() ? "anonymous" : callerId.trim();
        if (roles == null || roles.isBlank()) {
            return new Caller(id, Set.of());
        }
        Set<Role> parsed = Arrays.stream(roles.split(","))
            .filter(r -> !r.isBlank())
            .map(Role::fromValue)
            .collect(Collectors.toSet());
        return new Caller(id, parsed);
    }
}
