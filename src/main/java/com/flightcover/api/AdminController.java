package com.flightcover.api;

import com.flightcover.settlement.SettlementResult;
import com.flightcover.settlement.SettlementService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final SettlementService settlementService;

    public AdminController(SettlementService settlementService) {
        this.settlementService = settlementService;
    }

    @PostMapping("/withdrawals")
    public SettlementResult withdraw(@RequestBody WithdrawalRequest request,
                                     @RequestHeader(value = CallerHeaders.CALLER_ID, required = false) String callerId,
                                     @RequestHeader(value = CallerHeaders.CALLER_ROLES, required = false) String roles) {
        return settlementService.withdrawAll(CallerHeaders.resolve(callerId, roles), request.destination());
    }
}
