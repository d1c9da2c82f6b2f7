package com.flightcover.bus;

import com.flightcover.policy.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Appends policy notifications to the event log and fans them out to
 * in-process subscribers. Subscriber failures never reach the publishing
 * operation.
 *
 * Code holding a policy lock calls {@link #record} and hands the returned
 * events to {@link #dispatch} once the lock is released: subscribers such as
 * SSE streams may block on I/O.
 */
@Service
public class PolicyEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(PolicyEventPublisher.class);

    private final PolicyEventLog eventLog;
    private final Clock clock;
    private final ConcurrentHashMap<String, Consumer<PolicyEvent>> subscribers = new ConcurrentHashMap<>();

    public PolicyEventPublisher(PolicyEventLog eventLog, Clock clock) {
        this.eventLog = eventLog;
        this.clock = clock;
    }

    public PolicyEvent publish(PolicyEventType type, Policy policy, Map<String, Object> details) {
        return publish(type, policy.id(), policy.holder(), details);
    }

    public PolicyEvent publish(PolicyEventType type, Long policyId, String holder, Map<String, Object> details) {
        PolicyEvent appended = record(type, policyId, holder, details);
        dispatch(appended);
        return appended;
    }

    /** Appends to the log without notifying subscribers. */
    public PolicyEvent record(PolicyEventType type, Policy policy, Map<String, Object> details) {
        return record(type, policy.id(), policy.holder(), details);
    }

    public PolicyEvent record(PolicyEventType type, Long policyId, String holder, Map<String, Object> details) {
        PolicyEvent event = new PolicyEvent(
            null,
            UUID.randomUUID().toString(),
            type,
            policyId,
            holder,
            clock.instant(),
            Collections.unmodifiableMap(new LinkedHashMap<>(details))
        );
        return eventLog.append(event);
    }

    public void dispatch(PolicyEvent event) {
        subscribers.values().forEach(consumer -> {
            try {
                consumer.accept(event);
            } catch (Exception ex) {
                log.warn("Subscriber notification failed for event={} type={}: {}",
                    event.eventId(), event.type(), ex.getMessage());
            }
        });
    }

    public List<PolicyEvent> query(PolicyEventFilter filter, int limit) {
        return eventLog.query(filter, limit);
    }

    public long latestSequence() {
        return eventLog.getLatestSequence();
    }

    public String subscribe(Consumer<PolicyEvent> consumer) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, consumer);
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }
}
