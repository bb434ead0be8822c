package com.demo.lending.controller;

import com.demo.lending.controller.dto.EscrowDtos.LoanView;
import com.demo.lending.controller.dto.EscrowDtos.RollableResponse;
import com.demo.lending.controller.dto.EscrowDtos.SeizedResponse;
import com.demo.lending.controller.dto.GatewayDtos.*;
import com.demo.lending.service.EscrowService;
import com.demo.lending.service.gateway.RiskGateway;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/gateway")
@RequiredArgsConstructor
public class GatewayController {

    private final RiskGateway gateway;
    private final EscrowService escrows;

    @GetMapping
    public GatewayView state() {
        return GatewayView.from(gateway);
    }

    /** Operator lends gateway funds against a request that satisfies the protocol bounds */
    @PostMapping(value = "/clear", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public LoanView clear(@RequestHeader(Callers.HEADER) String caller, @Valid @RequestBody ClearRequest req) {
        String escrow = Callers.normalize(req.escrow);
        long loanId = escrows.gatewayClear(Callers.require(caller), escrow, req.requestId);
        return LoanView.from(loanId, escrows.getLoan(escrow, loanId));
    }

    @PostMapping(value = "/toggle-roll", consumes = MediaType.APPLICATION_JSON_VALUE)
    public RollableResponse toggleRoll(@RequestHeader(Callers.HEADER) String caller, @Valid @RequestBody LoanRef ref) {
        RollableResponse res = new RollableResponse();
        res.rollable = escrows.gatewayToggleRoll(Callers.require(caller), Callers.normalize(ref.escrow), ref.loanId);
        return res;
    }

    @PostMapping(value = "/claim-default", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SeizedResponse claimDefault(@RequestHeader(Callers.HEADER) String caller, @Valid @RequestBody LoanRef ref) {
        SeizedResponse res = new SeizedResponse();
        res.seized = escrows.gatewayClaimDefault(Callers.require(caller), Callers.normalize(ref.escrow), ref.loanId);
        return res;
    }

    // -------- treasury ----------

    @PostMapping(value = "/fund", consumes = MediaType.APPLICATION_JSON_VALUE)
    public GatewayView fund(@RequestHeader(Callers.HEADER) String caller, @Valid @RequestBody FundRequest req) {
        gateway.fund(escrows.external(Callers.require(caller)), req.amount);
        return GatewayView.from(gateway);
    }

    @PostMapping(value = "/defund", consumes = MediaType.APPLICATION_JSON_VALUE)
    public GatewayView defund(@RequestHeader(Callers.HEADER) String caller, @Valid @RequestBody DefundRequest req) {
        gateway.defund(escrows.external(Callers.require(caller)), req.asset, req.amount);
        return GatewayView.from(gateway);
    }

    // -------- roles ----------

    @PostMapping(value = "/operator/propose", consumes = MediaType.APPLICATION_JSON_VALUE)
    public GatewayView proposeOperator(@RequestHeader(Callers.HEADER) String caller, @RequestBody RoleProposal req) {
        gateway.proposeOperator(escrows.external(Callers.require(caller)), Callers.optional(req.candidate));
        return GatewayView.from(gateway);
    }

    @PostMapping("/operator/accept")
    public GatewayView acceptOperator(@RequestHeader(Callers.HEADER) String caller) {
        gateway.acceptOperator(escrows.external(Callers.require(caller)));
        return GatewayView.from(gateway);
    }

    @PostMapping(value = "/overseer/propose", consumes = MediaType.APPLICATION_JSON_VALUE)
    public GatewayView proposeOverseer(@RequestHeader(Callers.HEADER) String caller, @RequestBody RoleProposal req) {
        gateway.proposeOverseer(escrows.external(Callers.require(caller)), Callers.optional(req.candidate));
        return GatewayView.from(gateway);
    }

    @PostMapping("/overseer/accept")
    public GatewayView acceptOverseer(@RequestHeader(Callers.HEADER) String caller) {
        gateway.acceptOverseer(escrows.external(Callers.require(caller)));
        return GatewayView.from(gateway);
    }
}
