package com.flightcover.api;

import com.flightcover.policy.Policy;
import com.flightcover.policy.PolicyService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Policy purchase and read-only queries.
 *
 * POST /v1/policies
 * GET  /v1/policies/{policyId}
 * GET  /v1/holders/{holder}/policies
 */
@RestController
@RequestMapping("/v1")
public class PolicyController {

    private final PolicyService policyService;

    public PolicyController(PolicyService policyService) {
        this.policyService = policyService;
    }

    @PostMapping("/policies")
    public ResponseEntity<Policy> create(@RequestBody CreatePolicyRequest request) {
        Policy policy = policyService.createPolicy(
            request.holder(),
            request.flightCode(),
            request.scheduledDeparture(),
            request.scheduledArrival(),
            request.paidAmount()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(policy);
    }

    @GetMapping("/policies/{policyId}")
    public Policy get(@PathVariable long policyId) {
        return policyService.getPolicy(policyId);
    }

    @GetMapping("/holders/{holder}/policies")
    public Map<String, Object> byHolder(@PathVariable String holder) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("holder", holder);
        body.put("policy_ids", policyService.getPoliciesByHolder(holder));
        return body;
    }
}
