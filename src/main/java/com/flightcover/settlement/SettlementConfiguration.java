package com.flightcover.settlement;

import com.flightcover.bus.PolicyEventPublisher;
import com.flightcover.bus.PolicyEventType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;

@Configuration
public class SettlementConfiguration {

    /**
     * Reference ledger seeded with the configured reserve. Premiums of newly
     * created policies are deposited from the POLICY_CREATED notification.
     */
    @Bean
    public ReserveSettlementGateway settlementGateway(
            @Value("${flightcover.settlement.initial-reserve:0}") BigDecimal initialReserve,
            PolicyEventPublisher publisher,
            Clock clock) {
        ReserveSettlementGateway gateway = new ReserveSettlementGateway(initialReserve, clock);
        publisher.subscribe(event -> {
            if (event.type() == PolicyEventType.POLICY_CREATED) {
                gateway.deposit("premium-" + event.policyId(), event.holder(),
                    (BigDecimal) event.details().get("premium"));
            }
        });
        return gateway;
    }
}
