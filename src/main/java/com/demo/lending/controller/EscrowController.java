package com.demo.lending.controller;

import com.demo.lending.controller.dto.EscrowDtos.*;
import com.demo.lending.service.EscrowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/escrows")
@RequiredArgsConstructor
public class EscrowController {

    private final EscrowService escrows;

    /** Escrow for (caller, collateral, debt); created on first call, same address afterwards */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public EscrowView generate(@RequestHeader(Callers.HEADER) String caller,
                               @Valid @RequestBody GenerateRequest req) {
        String address = escrows.generate(Callers.require(caller), req.collateralAsset, req.debtAsset);
        return EscrowView.from(escrows.escrow(address));
    }

    @GetMapping
    public List<EscrowView> list() {
        return escrows.list().stream().map(EscrowView::from).collect(Collectors.toList());
    }

    @GetMapping("/{escrow}")
    public EscrowView detail(@PathVariable String escrow) {
        return EscrowView.from(escrows.escrow(Callers.normalize(escrow)));
    }

    // -------- requests ----------

    @PostMapping(value = "/{escrow}/requests", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedResponse request(@RequestHeader(Callers.HEADER) String caller,
                                   @PathVariable String escrow,
                                   @Valid @RequestBody RequestTerms terms) {
        String address = Callers.normalize(escrow);
        long id = escrows.request(Callers.require(caller), address,
                terms.amount, terms.interest, terms.loanToCollateral, terms.duration);
        return CreatedResponse.of(address, id);
    }

    @GetMapping("/{escrow}/requests")
    public List<RequestView> requests(@PathVariable String escrow) {
        return escrows.listRequests(Callers.normalize(escrow)).stream()
                .map(r -> RequestView.from(r.id(), r.request()))
                .collect(Collectors.toList());
    }

    @GetMapping("/{escrow}/requests/{id}")
    public RequestView requestDetail(@PathVariable String escrow, @PathVariable long id) {
        return RequestView.from(id, escrows.getRequest(Callers.normalize(escrow), id));
    }

    @PostMapping("/{escrow}/requests/{id}/rescind")
    public RequestView rescind(@RequestHeader(Callers.HEADER) String caller,
                               @PathVariable String escrow, @PathVariable long id) {
        String address = Callers.normalize(escrow);
        escrows.rescind(Callers.require(caller), address, id);
        return RequestView.from(id, escrows.getRequest(address, id));
    }

    /** Lender fills the request directly; no protocol bounds apply on this path */
    @PostMapping("/{escrow}/requests/{id}/clear")
    @ResponseStatus(HttpStatus.CREATED)
    public LoanView clear(@RequestHeader(Callers.HEADER) String caller,
                          @PathVariable String escrow, @PathVariable long id) {
        String address = Callers.normalize(escrow);
        long loanId = escrows.clear(Callers.require(caller), address, id);
        return LoanView.from(loanId, escrows.getLoan(address, loanId));
    }

    // -------- loans ----------

    @GetMapping("/{escrow}/loans")
    public List<LoanView> loans(@PathVariable String escrow) {
        return escrows.listLoans(Callers.normalize(escrow)).stream()
                .map(l -> LoanView.from(l.id(), l.loan()))
                .collect(Collectors.toList());
    }

    @GetMapping("/{escrow}/loans/{id}")
    public LoanView loanDetail(@PathVariable String escrow, @PathVariable long id) {
        return LoanView.from(id, escrows.getLoan(Callers.normalize(escrow), id));
    }

    @PostMapping(value = "/{escrow}/loans/{id}/repay", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void repay(@RequestHeader(Callers.HEADER) String caller,
                      @PathVariable String escrow, @PathVariable long id,
                      @Valid @RequestBody RepayRequest req) {
        escrows.repay(Callers.require(caller), Callers.normalize(escrow), id, req.amount);
    }

    @PostMapping("/{escrow}/loans/{id}/roll")
    public LoanView roll(@RequestHeader(Callers.HEADER) String caller,
                         @PathVariable String escrow, @PathVariable long id) {
        String address = Callers.normalize(escrow);
        escrows.roll(Callers.require(caller), address, id);
        return LoanView.from(id, escrows.getLoan(address, id));
    }

    @PostMapping("/{escrow}/loans/{id}/toggle-roll")
    public RollableResponse toggleRoll(@RequestHeader(Callers.HEADER) String caller,
                                       @PathVariable String escrow, @PathVariable long id) {
        RollableResponse res = new RollableResponse();
        res.rollable = escrows.toggleRoll(Callers.require(caller), Callers.normalize(escrow), id);
        return res;
    }

    @PostMapping("/{escrow}/loans/{id}/default")
    public SeizedResponse defaulted(@RequestHeader(Callers.HEADER) String caller,
                                    @PathVariable String escrow, @PathVariable long id) {
        SeizedResponse res = new SeizedResponse();
        res.seized = escrows.defaulted(Callers.require(caller), Callers.normalize(escrow), id);
        return res;
    }
}
