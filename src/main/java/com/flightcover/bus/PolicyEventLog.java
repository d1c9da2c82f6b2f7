package com.flightcover.bus;

import java.util.List;

public interface PolicyEventLog {

    PolicyEvent append(PolicyEvent event);

    /** Matching events in sequence order, at most {@code limit} of them. */
    List<PolicyEvent> query(PolicyEventFilter filter, int limit);

    long getLatestSequence();
}
