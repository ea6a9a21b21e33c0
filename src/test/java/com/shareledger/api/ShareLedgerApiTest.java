package com.shareledger.api;

import com.shareledger.api.controller.ApiHeaders;
import com.shareledger.chain.BlockHeightProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST tests: ledger rejections map to HTTP statuses and keep their numbered codes.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class ShareLedgerApiTest {

    private static final String REGISTRAR = "registrar";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private BlockHeightProvider blockHeightProvider;

    private void tokenize() throws Exception {
        mockMvc.perform(post("/api/v1/assets")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"metadataUri\":\"ipfs://x\",\"value\":5000}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.assetId").value(1))
            .andExpect(jsonPath("$.owner").value(REGISTRAR));
    }

    private void attest(String address) throws Exception {
        mockMvc.perform(put("/api/v1/compliance/" + address)
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"approved\":true,\"level\":1,\"validForBlocks\":1000}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.approved").value(true));
    }

    @Test
    void testTokenizeAndReadBalance() throws Exception {
        tokenize();

        mockMvc.perform(get("/api/v1/assets/1/balances/" + REGISTRAR))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.amount").value(100000));
        mockMvc.perform(get("/api/v1/assets/1/balances/nobody"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.amount").value(0));
    }

    @Test
    void testAuthorizationRejectionIs403() throws Exception {
        mockMvc.perform(post("/api/v1/assets")
                .header(ApiHeaders.CALLER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"metadataUri\":\"ipfs://x\",\"value\":5000}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("NotAuthorized"))
            .andExpect(jsonPath("$.codeNumber").value("104"));
    }

    @Test
    void testUnknownAssetIs404() throws Exception {
        mockMvc.perform(get("/api/v1/assets/99"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NotFound"))
            .andExpect(jsonPath("$.codeNumber").value("101"));
    }

    @Test
    void testInvalidInputIs400() throws Exception {
        mockMvc.perform(post("/api/v1/assets")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"metadataUri\":\"ipfs://x\",\"value\":999}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("InvalidValue"));

        mockMvc.perform(post("/api/v1/assets")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"metadataUri\":\"ipfs://x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.value").value("Value is required"));

        mockMvc.perform(post("/api/v1/assets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"metadataUri\":\"ipfs://x\",\"value\":5000}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testVoteFlowConflictsAre409() throws Exception {
        tokenize();
        attest(REGISTRAR);

        mockMvc.perform(post("/api/v1/proposals")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"assetId\":1,\"title\":\"Sell\",\"durationBlocks\":12,\"minimumThreshold\":30000}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.proposalId").value(1));

        String vote = "{\"support\":true,\"weight\":30000}";
        mockMvc.perform(post("/api/v1/proposals/1/votes")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content(vote))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.weight").value(30000));
        mockMvc.perform(post("/api/v1/proposals/1/votes")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content(vote))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("VoteExists"));

        mockMvc.perform(post("/api/v1/proposals/1/finalize").header(ApiHeaders.CALLER, REGISTRAR))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ProposalOpen"))
            .andExpect(jsonPath("$.codeNumber").value("118"));

        mockMvc.perform(get("/api/v1/proposals/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("OPEN"))
            .andExpect(jsonPath("$.proposal.votesFor").value(30000));
    }

    @Test
    void testMalformedCallerIs400() throws Exception {
        mockMvc.perform(post("/api/v1/assets")
                .header(ApiHeaders.CALLER, "a".repeat(129))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"metadataUri\":\"ipfs://x\",\"value\":5000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("InvalidAddress"))
            .andExpect(jsonPath("$.codeNumber").value("115"));

        mockMvc.perform(get("/api/v1/assets/1"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testFinalizeReportsOutcome() throws Exception {
        tokenize();
        attest(REGISTRAR);

        mockMvc.perform(post("/api/v1/proposals")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"assetId\":1,\"title\":\"Sell\",\"durationBlocks\":12,\"minimumThreshold\":30000}"))
            .andExpect(status().isCreated());
        mockMvc.perform(post("/api/v1/proposals/1/votes")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"support\":true,\"weight\":30000}"))
            .andExpect(status().isCreated());

        long finalizedAt = blockHeightProvider.currentHeight() + 12;
        mockMvc.perform(post("/api/v1/chain/advance")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"blocks\":12}"))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/proposals/1/finalize").header(ApiHeaders.CALLER, REGISTRAR))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.passed").value(true))
            .andExpect(jsonPath("$.votesFor").value(30000))
            .andExpect(jsonPath("$.finalizedAt").value(finalizedAt));
        mockMvc.perform(get("/api/v1/proposals/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FINALIZED"));
    }

    @Test
    void testStalePriceIs422() throws Exception {
        tokenize();

        mockMvc.perform(put("/api/v1/assets/1/price")
                .header(ApiHeaders.CALLER, "oracle-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"price\":250000,\"decimals\":2}"))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/assets/1/valuation/" + REGISTRAR))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.shares").value(100000));

        long expectedHeight = blockHeightProvider.currentHeight() + 145;
        mockMvc.perform(post("/api/v1/chain/advance")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"blocks\":145}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.height").value(expectedHeight));

        mockMvc.perform(get("/api/v1/assets/1/valuation/" + REGISTRAR))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("PriceExpired"));
        mockMvc.perform(get("/api/v1/assets/1/price"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.price").value(250000));
    }

    @Test
    void testHarvestCreditsPayoutAccount() throws Exception {
        tokenize();
        attest(REGISTRAR);

        mockMvc.perform(post("/api/v1/assets/1/revenue")
                .header(ApiHeaders.CALLER, REGISTRAR)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":10000}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accruedRevenue").value(10000));

        mockMvc.perform(post("/api/v1/assets/1/dividends/harvest").header(ApiHeaders.CALLER, REGISTRAR))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.amount").value(10000))
            .andExpect(jsonPath("$.lastClaimedAccrual").value(10000))
            .andExpect(jsonPath("$.payoutBalance").value(10000));
        mockMvc.perform(post("/api/v1/assets/1/dividends/harvest").header(ApiHeaders.CALLER, REGISTRAR))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("InvalidAmount"));

        mockMvc.perform(get("/api/v1/payouts/" + REGISTRAR))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(10000));
        mockMvc.perform(get("/api/v1/payouts/" + REGISTRAR + "/ledger"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].entryType").value("CREDIT"));
    }
}
