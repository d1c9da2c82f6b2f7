package com.flightcover.claim;

import com.flightcover.access.AccessGuard;
import com.flightcover.bus.PolicyEventPublisher;
import com.flightcover.policy.PolicyLocks;
import com.flightcover.policy.PolicyStore;
import com.flightcover.settlement.SettlementGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClaimConfiguration {

    @Bean
    public ClaimEvaluator claimEvaluator(PolicyStore store,
                                         PolicyLocks locks,
                                         AccessGuard accessGuard,
                                         SettlementGateway settlementGateway,
                                         PolicyEventPublisher publisher) {
        return new ClaimEvaluator(ClaimRules.standard(), store, locks, accessGuard,
            settlementGateway, publisher);
    }
}
