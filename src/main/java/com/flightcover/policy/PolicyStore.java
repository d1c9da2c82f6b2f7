package com.flightcover.policy;

import java.util.List;
import java.util.Optional;
import java.util.function.LongFunction;

public interface PolicyStore {

    /**
     * Allocates the next policy id, stores the policy built by the factory and
     * appends the id to the holder's index. Creations for the same holder are
     * serialized so the index stays in id order.
     */
    Policy create(String holder, LongFunction<Policy> factory);

    Optional<Policy> findById(long policyId);

    /** Replaces the stored snapshot of an existing policy. */
    void save(Policy policy);

    List<Long> findIdsByHolder(String holder);

    List<Policy> findByStatus(PolicyStatus status);

    long count();
}
