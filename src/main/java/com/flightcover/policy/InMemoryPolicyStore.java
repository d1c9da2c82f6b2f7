package com.flightcover.policy;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongFunction;
import java.util.stream.Collectors;

@Component
public class InMemoryPolicyStore implements PolicyStore {

    private final ConcurrentHashMap<Long, Policy> policies = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Long>> holderIndex = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public Policy create(String holder, LongFunction<Policy> factory) {
        Policy[] created = new Policy[1];
        // compute() locks the holder's bin: id allocation and append happen together
        holderIndex.compute(holder, (key, ids) -> {
            CopyOnWriteArrayList<Long> index = ids != null ? ids : new CopyOnWriteArrayList<>();
            Policy policy = factory.apply(sequence.incrementAndGet());
            policies.put(policy.id(), policy);
            index.add(policy.id());
            created[0] = policy;
            return index;
        });
        return created[0];
    }

    @Override
    public Optional<Policy> findById(long policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }

    @Override
    public void save(Policy policy) {
        if (policies.replace(policy.id(), policy) == null) {
            throw new IllegalStateException("cannot save unknown policy " + policy.id());
        }
    }

    @Override
    public List<Long> findIdsByHolder(String holder) {
        List<Long> ids = holderIndex.get(holder);
        return ids == null ? List.of() : List.copyOf(ids);
    }

    @Override
    public List<Policy> findByStatus(PolicyStatus status) {
        return policies.values().stream()
            .filter(p -> p.status() == status)
            .sorted(Comparator.comparingLong(Policy::id))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public long count() {
        return policies.size();
    }
}
