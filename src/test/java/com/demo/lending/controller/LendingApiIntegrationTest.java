package com.demo.lending.controller;

import com.demo.lending.service.HashUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "lending.assets.faucet-enabled=true")
@AutoConfigureMockMvc
@DisplayName("Lending HTTP API")
class LendingApiIntegrationTest {

    // matches application.properties
    static final String GATEWAY = "0x00000000000000000000000000000000000c1ea2";
    static final String OPERATOR = "0x0000000000000000000000000000000000000a11";
    static final String OVERSEER = "0x0000000000000000000000000000000000000b22";
    static final String TREASURY = "0x0000000000000000000000000000000000007ea5";

    static final String ONE = "1000000000000000000";
    static final String AMOUNT = "2500000000000000000000";
    static final String TERMS = "{\"amount\":\"2500000000000000000000\",\"interest\":\"20000000000000000\","
            + "\"loanToCollateral\":\"2500000000000000000000\",\"duration\":31536000}";

    @Autowired
    private MockMvc mvc;

    private ResultActions postJson(String url, String caller, String json) throws Exception {
        var req = post(url).contentType(MediaType.APPLICATION_JSON).content(json);
        if (caller != null) {
            req.header("X-Caller", caller);
        }
        return mvc.perform(req);
    }

    /** Mints collateral to the borrower, opens its escrow and one request; returns the escrow address. */
    private String openRequest(String borrower) throws Exception {
        String escrow = HashUtil.escrowAddress(borrower, "gOHM", "DAI");
        postJson("/api/assets/gOHM/mint", null, "{\"to\":\"" + borrower + "\",\"amount\":\"" + ONE + "\"}")
                .andExpect(status().isOk());
        postJson("/api/escrows", borrower, "{\"collateralAsset\":\"gOHM\",\"debtAsset\":\"DAI\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address").value(escrow))
                .andExpect(jsonPath("$.owner").value(borrower));
        postJson("/api/assets/gOHM/approve", borrower, "{\"spender\":\"" + escrow + "\",\"amount\":\"" + ONE + "\"}")
                .andExpect(status().isOk());
        postJson("/api/escrows/" + escrow + "/requests", borrower, TERMS)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(0));
        return escrow;
    }

    @Test
    @DisplayName("borrower requests, gateway clears, borrower repays")
    void gatewayLifecycle() throws Exception {
        String borrower = "0x00000000000000000000000000000000000000a1";
        String escrow = openRequest(borrower);

        mvc.perform(get("/api/escrows/" + escrow + "/requests/0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.collateral").value(ONE));

        postJson("/api/assets/DAI/mint", null, "{\"to\":\"" + TREASURY + "\",\"amount\":\"" + AMOUNT + "\"}")
                .andExpect(status().isOk());
        postJson("/api/gateway/fund", OVERSEER, "{\"amount\":\"" + AMOUNT + "\"}")
                .andExpect(status().isOk());

        postJson("/api/gateway/clear", OPERATOR, "{\"escrow\":\"" + escrow + "\",\"requestId\":0}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(0))
                .andExpect(jsonPath("$.amount").value("2550000000000000000000"))
                .andExpect(jsonPath("$.amountFormatted").value("2550"))
                .andExpect(jsonPath("$.collateral").value(ONE))
                .andExpect(jsonPath("$.lender").value(GATEWAY))
                .andExpect(jsonPath("$.rollable").value(true));

        mvc.perform(get("/api/assets/DAI/balances/" + borrower))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(AMOUNT));

        postJson("/api/assets/DAI/approve", borrower, "{\"spender\":\"" + escrow + "\",\"amount\":\"" + AMOUNT + "\"}")
                .andExpect(status().isOk());
        postJson("/api/escrows/" + escrow + "/loans/0/repay", borrower, "{\"amount\":\"1275000000000000000000\"}")
                .andExpect(status().isNoContent());

        mvc.perform(get("/api/escrows/" + escrow + "/loans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].amount").value("1275000000000000000000"))
                .andExpect(jsonPath("$[0].collateral").value("500000000000000000"));
    }

    @Test
    void gatewayRejectsNonOperator() throws Exception {
        String escrow = openRequest("0x00000000000000000000000000000000000000a2");

        postJson("/api/gateway/clear", OVERSEER, "{\"escrow\":\"" + escrow + "\",\"requestId\":0}")
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("Unauthorized"));
    }

    @Test
    void rescindTwiceConflicts() throws Exception {
        String borrower = "0x00000000000000000000000000000000000000a3";
        String escrow = openRequest(borrower);

        mvc.perform(post("/api/escrows/" + escrow + "/requests/0/rescind").header("X-Caller", borrower))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
        mvc.perform(post("/api/escrows/" + escrow + "/requests/0/rescind").header("X-Caller", borrower))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("InvalidState"));

        mvc.perform(get("/api/assets/gOHM/balances/" + borrower))
                .andExpect(jsonPath("$.balance").value(ONE));
    }

    @Test
    @DisplayName("an escrow address cannot be used as a caller")
    void escrowCannotActAsCaller() throws Exception {
        String escrow = openRequest("0x00000000000000000000000000000000000000a4");
        String attacker = "0x00000000000000000000000000000000000000a5";

        postJson("/api/assets/gOHM/approve", escrow, "{\"spender\":\"" + attacker + "\",\"amount\":\"" + ONE + "\"}")
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("Unauthorized"));
        mvc.perform(get("/api/assets/gOHM/allowances/" + escrow + "/" + attacker))
                .andExpect(jsonPath("$.allowance").value("0"));

        postJson("/api/escrows/" + escrow + "/requests", escrow, TERMS)
                .andExpect(status().isForbidden());
        mvc.perform(get("/api/assets/gOHM/balances/" + escrow))
                .andExpect(jsonPath("$.balance").value(ONE));
    }

    @Test
    void unknownEscrowIsNotFound() throws Exception {
        mvc.perform(get("/api/escrows/0x00000000000000000000000000000000000000dd"))
                .andExpect(status().isNotFound());
    }

    @Test
    void callerMustBeAnAddress() throws Exception {
        postJson("/api/escrows", "bob", "{\"collateralAsset\":\"gOHM\",\"debtAsset\":\"DAI\"}")
                .andExpect(status().isBadRequest());
        postJson("/api/escrows", null, "{\"collateralAsset\":\"gOHM\",\"debtAsset\":\"DAI\"}")
                .andExpect(status().isBadRequest());
    }

    @Test
    void gatewayStateIsPublic() throws Exception {
        mvc.perform(get("/api/gateway"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operator").value(OPERATOR))
                .andExpect(jsonPath("$.minimumInterest").value("20000000000000000"))
                .andExpect(jsonPath("$.maxDuration").value(31536000));
    }

    @Test
    void apiDocsDeclareTheCallerHeader() throws Exception {
        mvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Collateral Lending API"))
                .andExpect(jsonPath("$.components.securitySchemes.caller.name").value("X-Caller"))
                .andExpect(jsonPath("$.components.securitySchemes.caller.in").value("header"));
    }
}
