package com.flightcover.api;

import com.flightcover.ingest.FlightInfoIngestService;
import com.flightcover.policy.Policy;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Oracle feed: PUT /v1/policies/{policyId}/flight-info
 */
@RestController
@RequestMapping("/v1/policies")
public class FlightInfoController {

    private final FlightInfoIngestService ingestService;

    public FlightInfoController(FlightInfoIngestService ingestService) {
        this.ingestService = ingestService;
    }

    @PutMapping("/{policyId}/flight-info")
    public Policy update(@PathVariable long policyId,
                         @RequestBody FlightInfoRequest request,
                         @RequestHeader(value = CallerHeaders.CALLER_ID, required = false) String callerId,
                         @RequestHeader(value = CallerHeaders.CALLER_ROLES, required = false) String roles) {
        return ingestService.updateFlightInfo(
            CallerHeaders.resolve(callerId, roles),
            policyId,
            request.actualArrival(),
            request.flightStatus()
        );
    }
}
