package com.demo.lending.service.registry;

import com.demo.lending.exception.PolicyViolationException;
import com.demo.lending.exception.PolicyViolationException.Policy;
import com.demo.lending.service.events.EscrowEventSink;
import com.demo.lending.service.ledger.AssetLedgers;
import com.demo.lending.service.ledger.InMemoryAssetLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class InMemoryEscrowRegistryTest {

    static final String ALICE = "0x00000000000000000000000000000000000000a1";
    static final String BOB = "0x00000000000000000000000000000000000000b2";

    private InMemoryEscrowRegistry registry;

    @BeforeEach
    void setUp() {
        AssetLedgers ledgers = new AssetLedgers(List.of(
                new InMemoryAssetLedger("gOHM"), new InMemoryAssetLedger("DAI"), new InMemoryAssetLedger("WETH")));
        registry = new InMemoryEscrowRegistry(ledgers, mock(EscrowEventSink.class));
    }

    @Test
    void generateIsIdempotentPerTriple() {
        String first = registry.generate(ALICE, "gOHM", "DAI");
        String again = registry.generate(ALICE, "gOHM", "DAI");

        assertThat(again).isEqualTo(first);
        assertThat(registry.list()).hasSize(1);
        assertThat(registry.find(first)).hasValueSatisfying(e -> {
            assertThat(e.getOwner()).isEqualTo(ALICE);
            assertThat(e.collateralAsset()).isEqualTo("gOHM");
            assertThat(e.debtAsset()).isEqualTo("DAI");
        });
    }

    @Test
    void eachTripleGetsItsOwnEscrow() {
        String alice = registry.generate(ALICE, "gOHM", "DAI");
        String bob = registry.generate(BOB, "gOHM", "DAI");
        String aliceWeth = registry.generate(ALICE, "gOHM", "WETH");

        assertThat(List.of(alice, bob, aliceWeth)).doesNotHaveDuplicates();
        assertThat(alice).startsWith("0x").hasSize(42);
    }

    @Test
    void onlyIssuedEscrowsAreGenuine() {
        String issued = registry.generate(ALICE, "gOHM", "DAI");

        assertThat(registry.isGenuine(issued)).isTrue();
        assertThat(registry.isGenuine("0x00000000000000000000000000000000000000dd")).isFalse();
        assertThat(registry.find("0x00000000000000000000000000000000000000dd")).isEmpty();
    }

    @Test
    void unsupportedAssetIsRejected() {
        assertThatThrownBy(() -> registry.generate(ALICE, "gOHM", "USDC"))
                .isInstanceOf(PolicyViolationException.class)
                .extracting("policy").isEqualTo(Policy.UNSUPPORTED_ASSET);
        assertThat(registry.list()).isEmpty();
    }
}
