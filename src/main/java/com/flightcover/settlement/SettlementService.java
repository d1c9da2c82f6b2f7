package com.flightcover.settlement;

import com.flightcover.access.AccessGuard;
import com.flightcover.access.Caller;
import com.flightcover.access.Role;
import com.flightcover.bus.PolicyEventPublisher;
import com.flightcover.bus.PolicyEventType;
import com.flightcover.error.SettlementFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Administrative fund movements that sit outside claim evaluation.
 */
@Service
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final SettlementGateway gateway;
    private final AccessGuard accessGuard;
    private final PolicyEventPublisher publisher;

    public SettlementService(SettlementGateway gateway,
                             AccessGuard accessGuard,
                             PolicyEventPublisher publisher) {
        this.gateway = gateway;
        this.accessGuard = accessGuard;
        this.publisher = publisher;
    }

    public SettlementResult withdrawAll(Caller caller, String destination) {
        accessGuard.require(caller, "withdraw funds", Role.ADMIN);
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination is required");
        }

        SettlementResult result;
        try {
            result = gateway.withdrawAll(destination);
        } catch (RuntimeException ex) {
            log.warn("Withdrawal to {} failed: {}", destination, ex.getMessage());
            throw new SettlementFailureException("withdrawal to " + destination + " failed", ex);
        }
        if (!result.success()) {
            log.warn("Withdrawal to {} rejected by ledger: {}", destination, result.failureReason());
            throw new SettlementFailureException(
                "withdrawal to " + destination + " failed: " + result.failureReason());
        }

        log.info("Withdrew {} to {} (reference={}) by caller={}",
            result.amount(), destination, result.reference(), caller.id());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("destination", destination);
        details.put("amount", result.amount());
        details.put("reference", result.reference());
        details.put("requested_by", caller.id());
        publisher.publish(PolicyEventType.FUNDS_WITHDRAWN, null, null, details);
        return result;
    }
}
