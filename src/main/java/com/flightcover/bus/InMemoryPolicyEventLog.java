package com.flightcover.bus;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Component
public class InMemoryPolicyEventLog implements PolicyEventLog {

    private final CopyOnWriteArrayList<PolicyEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public synchronized PolicyEvent append(PolicyEvent event) {
        PolicyEvent sequenced = event.withSequenceNumber(sequence.incrementAndGet());
        events.add(sequenced);
        return sequenced;
    }

    @Override
    public List<PolicyEvent> query(PolicyEventFilter filter, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }

        return events.stream()
            .filter(filter::matches)
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public long getLatestSequence() {
        return sequence.get();
    }
}
