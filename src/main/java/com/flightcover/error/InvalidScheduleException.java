package com.flightcover.error;

import java.time.Duration;
import java.time.Instant;

public class InvalidScheduleException extends PolicyException {

    public InvalidScheduleException(Instant scheduledDeparture, Instant scheduledArrival) {
        super(ErrorKind.INVALID_SCHEDULE,
            "scheduled_arrival " + scheduledArrival + " must be after scheduled_departure " + scheduledDeparture);
    }

    public InvalidScheduleException(Instant scheduledArrival, Duration claimHorizon) {
        super(ErrorKind.INVALID_SCHEDULE,
            "scheduled_arrival " + scheduledArrival + " leaves no room for the " + claimHorizon + " claim horizon");
    }
}
