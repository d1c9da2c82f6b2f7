package com.flightcover.access;

import com.flightcover.error.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Checks the role a policy operation requires. How the caller proved its
 * identity is decided upstream.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    public void require(Caller caller, String operation, Role... anyOf) {
        if (caller == null || !caller.hasAnyRole(anyOf)) {
            String callerId = caller != null ? caller.id() : "unknown";
            log.warn("Rejected {} by caller={}: requires one of {}", operation, callerId, Arrays.toString(anyOf));
            throw new UnauthorizedException(callerId, operation);
        }
    }
}
