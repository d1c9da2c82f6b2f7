package com.flightcover.claim;

import com.flightcover.policy.Policy;

import java.util.List;

public final class ClaimRules {

    private ClaimRules() {
    }

    /**
     * The decision procedure in priority order. Cancellation and the no-data
     * timeout come before any comparison that needs the actual arrival.
     */
    public static List<ClaimRule> standard() {
        return List.of(
            new CancellationRule(),
            new NoDataTimeoutRule(Policy.NO_DATA_TIMEOUT),
            new AwaitingDataRule(),
            new OnTimeArrivalRule(),
            new LateArrivalRule()
        );
    }
}
