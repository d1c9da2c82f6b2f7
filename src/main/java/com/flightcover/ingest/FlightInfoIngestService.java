package com.flightcover.ingest;

import com.flightcover.access.AccessGuard;
import com.flightcover.access.Caller;
import com.flightcover.access.Role;
import com.flightcover.bus.PolicyEvent;
import com.flightcover.bus.PolicyEventPublisher;
import com.flightcover.bus.PolicyEventType;
import com.flightcover.error.PolicyNotActiveException;
import com.flightcover.error.PolicyNotFoundException;
import com.flightcover.policy.FlightStatus;
import com.flightcover.policy.Policy;
import com.flightcover.policy.PolicyLocks;
import com.flightcover.policy.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for observed flight data. Updates are last-write-wins and are
 * accepted only while the policy is ACTIVE.
 */
@Service
public class FlightInfoIngestService {

    private static final Logger log = LoggerFactory.getLogger(FlightInfoIngestService.class);

    private final PolicyStore store;
    private final PolicyLocks locks;
    private final AccessGuard accessGuard;
    private final PolicyEventPublisher publisher;
    private final Clock clock;

    public FlightInfoIngestService(PolicyStore store,
                                   PolicyLocks locks,
                                   AccessGuard accessGuard,
                                   PolicyEventPublisher publisher,
                                   Clock clock) {
        this.store = store;
        this.locks = locks;
        this.accessGuard = accessGuard;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Overwrites the observed arrival and flight status.
     *
     * @param actualArrival observed arrival, or null if still unknown
     * @throws PolicyNotActiveException if the policy already reached a terminal status
     */
    public Policy updateFlightInfo(Caller caller, long policyId,
                                   Instant actualArrival, FlightStatus flightStatus) {
        accessGuard.require(caller, "update flight info", Role.ORACLE, Role.ADMIN);
        if (flightStatus == null) {
            throw new IllegalArgumentException("flight_status is required");
        }

        Update update = locks.withLock(policyId, () -> {
            Policy current = store.findById(policyId)
                .orElseThrow(() -> new PolicyNotFoundException(policyId));
            if (!current.isActive()) {
                throw new PolicyNotActiveException(policyId, current.status());
            }

            Policy updated = current.withFlightInfo(actualArrival, flightStatus, clock.instant());
            store.save(updated);

            log.info("Flight info for policy {} set to arrival={} status={} by {}",
                policyId, actualArrival != null ? actualArrival : "unknown", flightStatus, caller.id());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("actual_arrival", actualArrival);
            details.put("flight_status", flightStatus.getValue());
            details.put("source", caller.id());
            PolicyEvent event = publisher.record(PolicyEventType.FLIGHT_INFO_UPDATED, updated, details);
            return new Update(updated, event);
        });
        // subscribers run outside the lock
        publisher.dispatch(update.event());
        return update.policy();
    }

    private record Update(Policy policy, PolicyEvent event) {
    }
}
