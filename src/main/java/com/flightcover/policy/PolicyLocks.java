package com.flightcover.policy;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-policy locks. Every mutation of an existing policy runs inside
 * {@link #withLock}, so mutations of one policy never interleave. Policies
 * whose ids hash to different stripes proceed in parallel; memory stays fixed
 * however many policies exist.
 */
@Component
public class PolicyLocks {

    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public PolicyLocks() {
        this(DEFAULT_STRIPES);
    }

    PolicyLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripe count must be positive, got " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(long policyId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(policyId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int stripeCount() {
        return stripes.length;
    }

    ReentrantLock stripeFor(long policyId) {
        return stripes[Math.floorMod(Long.hashCode(policyId), stripes.length)];
    }
}
