package com.demo.lending.controller;

import com.demo.lending.controller.dto.AssetDtos.*;
import com.demo.lending.exception.UnauthorizedException;
import com.demo.lending.service.EscrowService;
import com.demo.lending.service.ledger.AssetLedger;
import com.demo.lending.service.ledger.AssetLedgers;
import com.demo.lending.service.ledger.InMemoryAssetLedger;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigInteger;
import java.util.Map;

@RestController
@RequestMapping("/api/assets/{asset}")
public class AssetController {

    private final AssetLedgers ledgers;
    private final EscrowService escrows;
    private final boolean faucetEnabled;

    public AssetController(AssetLedgers ledgers, EscrowService escrows,
                           @Value("${lending.assets.faucet-enabled:false}") boolean faucetEnabled) {
        this.ledgers = ledgers;
        this.escrows = escrows;
        this.faucetEnabled = faucetEnabled;
    }

    @GetMapping("/balances/{holder}")
    public BalanceView balance(@PathVariable String asset, @PathVariable String holder) {
        String who = Callers.normalize(holder);
        return BalanceView.of(asset, who, ledgers.require(asset).balanceOf(who));
    }

    @GetMapping("/allowances/{owner}/{spender}")
    public Map<String, Object> allowance(@PathVariable String asset, @PathVariable String owner,
                                         @PathVariable String spender) {
        BigInteger allowed = ledgers.require(asset).allowance(Callers.normalize(owner), Callers.normalize(spender));
        return Map.of("asset", asset, "allowance", allowed);
    }

    /** Caller lets {@code spender} (usually an escrow) pull up to {@code amount} */
    @PostMapping(value = "/approve", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> approve(@PathVariable String asset,
                                       @RequestHeader(Callers.HEADER) String caller,
                                       @Valid @RequestBody ApproveRequest req) {
        String owner = escrows.external(Callers.require(caller));
        String spender = Callers.normalize(req.spender);
        AssetLedger ledger = ledgers.require(asset);
        ledger.approve(owner, spender, req.amount);
        return Map.of("asset", asset, "allowance", ledger.allowance(owner, spender));
    }

    @PostMapping(value = "/mint", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BalanceView mint(@PathVariable String asset, @Valid @RequestBody MintRequest req) {
        if (!faucetEnabled) {
            throw new UnauthorizedException("Faucet disabled");
        }
        AssetLedger ledger = ledgers.require(asset);
        if (!(ledger instanceof InMemoryAssetLedger)) {
            throw new ResponseStatusException(HttpStatus.NOT_IMPLEMENTED, asset + " ledger cannot mint");
        }
        String to = Callers.normalize(req.to);
        ((InMemoryAssetLedger) ledger).mint(to, req.amount);
        return BalanceView.of(asset, to, ledger.balanceOf(to));
    }
}
