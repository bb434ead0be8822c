package com.demo.lending.config;

import com.demo.lending.service.events.EscrowEventSink;
import com.demo.lending.service.events.LoggingEscrowEventSink;
import com.demo.lending.service.events.WebhookEscrowEventSink;
import com.demo.lending.service.gateway.GatewayPolicy;
import com.demo.lending.service.gateway.LedgerTreasury;
import com.demo.lending.service.gateway.RiskGateway;
import com.demo.lending.service.gateway.Treasury;
import com.demo.lending.service.ledger.AssetLedgers;
import com.demo.lending.service.ledger.InMemoryAssetLedger;
import com.demo.lending.service.registry.EscrowRegistry;
import com.demo.lending.service.registry.InMemoryEscrowRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Wires the protocol components. Ledgers are process-local; swap {@link AssetLedgers} for an
 * on-chain adapter to run against real tokens.
 */
@Slf4j
@Configuration
public class LendingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AssetLedgers assetLedgers(@Value("${lending.assets.collateral:gOHM}") String collateralAsset,
                                     @Value("${lending.assets.debt:DAI}") String debtAsset) {
        return new AssetLedgers(List.of(
                new InMemoryAssetLedger(collateralAsset),
                new InMemoryAssetLedger(debtAsset)));
    }

    @Bean
    public EscrowEventSink escrowEventSink(RestTemplate restTemplate,
                                           @Value("${lending.notify.base-url:}") String notifyBaseUrl) {
        if (StringUtils.hasText(notifyBaseUrl)) {
            log.info("Escrow events delivered to {}", notifyBaseUrl);
            return new WebhookEscrowEventSink(restTemplate, notifyBaseUrl);
        }
        return new LoggingEscrowEventSink();
    }

    @Bean
    public EscrowRegistry escrowRegistry(AssetLedgers assetLedgers, EscrowEventSink escrowEventSink) {
        return new InMemoryEscrowRegistry(assetLedgers, escrowEventSink);
    }

    @Bean
    public Treasury treasury(AssetLedgers assetLedgers,
                             @Value("${lending.treasury.address}") String treasuryAddress) {
        return new LedgerTreasury(treasuryAddress.toLowerCase(), assetLedgers);
    }

    @Bean
    public GatewayPolicy gatewayPolicy(@Value("${lending.gateway.minimum-interest}") BigInteger minimumInterest,
                                       @Value("${lending.gateway.max-loan-to-collateral}") BigInteger maxLoanToCollateral,
                                       @Value("${lending.gateway.max-duration}") long maxDuration) {
        return new GatewayPolicy(minimumInterest, maxLoanToCollateral, maxDuration);
    }

    @Bean
    public RiskGateway riskGateway(AssetLedgers assetLedgers, EscrowRegistry escrowRegistry, Treasury treasury,
                                   GatewayPolicy gatewayPolicy,
                                   @Value("${lending.assets.collateral:gOHM}") String collateralAsset,
                                   @Value("${lending.assets.debt:DAI}") String debtAsset,
                                   @Value("${lending.gateway.address}") String address,
                                   @Value("${lending.gateway.operator}") String operator,
                                   @Value("${lending.gateway.overseer}") String overseer) {
        log.info("Risk gateway {} lending {} against {} under {}", address, debtAsset, collateralAsset, gatewayPolicy);
        return new RiskGateway(address.toLowerCase(), operator.toLowerCase(), overseer.toLowerCase(),
                assetLedgers.require(collateralAsset), assetLedgers.require(debtAsset),
                escrowRegistry, treasury, gatewayPolicy);
    }
}
