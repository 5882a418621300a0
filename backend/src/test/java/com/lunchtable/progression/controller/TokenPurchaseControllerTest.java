package com.lunchtable.progression.controller;

import com.lunchtable.progression.model.PurchaseStatus;
import com.lunchtable.progression.service.PurchaseConfirmationWorkflow;
import com.lunchtable.progression.service.TokenBalanceService;
import com.lunchtable.progression.web.ProgressionException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TokenPurchaseController.class)
class TokenPurchaseControllerTest {

    private static final String BUYER_WALLET = "9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin";
    private static final String TREASURY_WALLET = "So11111111111111111111111111111111111111112";
    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PurchaseConfirmationWorkflow purchaseConfirmationWorkflow;

    @MockitoBean
    private TokenBalanceService tokenBalanceService;

    @Test
    void initiateReturnsCreatedIntent() throws Exception {
        UUID purchaseId = UUID.fromString("00000000-0000-0000-0000-000000000101");
        when(purchaseConfirmationWorkflow.initiate("player-1", BUYER_WALLET)).thenReturn(
                new PurchaseConfirmationWorkflow.PurchaseIntent(
                        purchaseId,
                        "AQABAg==",
                        3_000L,
                        TREASURY_WALLET,
                        "TokenMint1111111111111111111111111111111111",
                        NOW.plusMinutes(5)
                )
        );

        mockMvc.perform(post("/api/battle-pass/premium/token")
                        .header(PlayerHeaders.PLAYER_ID, "player-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "buyerWallet": "9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.purchaseId").value(purchaseId.toString()))
                .andExpect(jsonPath("$.transaction").value("AQABAg=="))
                .andExpect(jsonPath("$.amount").value(3000))
                .andExpect(jsonPath("$.treasuryWallet").value(TREASURY_WALLET));
    }

    @Test
    void initiateRejectsBlankWallet() throws Exception {
        mockMvc.perform(post("/api/battle-pass/premium/token")
                        .header(PlayerHeaders.PLAYER_ID, "player-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "buyerWallet": " "
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.buyerWallet").value("buyerWallet is required"));

        verify(purchaseConfirmationWorkflow, never()).initiate(anyString(), anyString());
    }

    @Test
    void rateLimitedInitiationCarriesResetTime() throws Exception {
        when(purchaseConfirmationWorkflow.initiate("player-1", BUYER_WALLET))
                .thenThrow(ProgressionException.rateLimited("Too many purchase attempts", NOW.plusSeconds(100)));

        mockMvc.perform(post("/api/battle-pass/premium/token")
                        .header(PlayerHeaders.PLAYER_ID, "player-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "buyerWallet": "9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin"
                                }
                                """))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("rate_limited"))
                .andExpect(jsonPath("$.resetAt").exists());
    }

    @Test
    void submitReturnsAcceptedPurchase() throws Exception {
        UUID purchaseId = UUID.fromString("00000000-0000-0000-0000-000000000102");
        when(purchaseConfirmationWorkflow.submit("player-1", purchaseId, "sig-1"))
                .thenReturn(view(purchaseId, PurchaseStatus.SUBMITTED, "sig-1"));

        mockMvc.perform(post("/api/battle-pass/premium/token/{purchaseId}/submit", purchaseId)
                        .header(PlayerHeaders.PLAYER_ID, "player-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "signature": "sig-1"
                                }
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.signature").value("sig-1"));
    }

    @Test
    void purchaseOfAnotherPlayerIsForbidden() throws Exception {
        UUID purchaseId = UUID.fromString("00000000-0000-0000-0000-000000000103");
        when(purchaseConfirmationWorkflow.getPurchase("player-2", purchaseId))
                .thenThrow(ProgressionException.forbidden("Purchase belongs to another player"));

        mockMvc.perform(get("/api/battle-pass/premium/token/{purchaseId}", purchaseId)
                        .header(PlayerHeaders.PLAYER_ID, "player-2"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("forbidden"));
    }

    @Test
    void listReturnsRecentPurchases() throws Exception {
        UUID purchaseId = UUID.fromString("00000000-0000-0000-0000-000000000104");
        when(purchaseConfirmationWorkflow.listRecentPurchases("player-1"))
                .thenReturn(List.of(view(purchaseId, PurchaseStatus.CONFIRMED, "sig-4")));

        mockMvc.perform(get("/api/battle-pass/premium/token")
                        .header(PlayerHeaders.PLAYER_ID, "player-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].purchaseId").value(purchaseId.toString()))
                .andExpect(jsonPath("$[0].status").value("CONFIRMED"));
    }

    @Test
    void balanceReturnsCachedTokenBalance() throws Exception {
        when(tokenBalanceService.getBalance("player-1")).thenReturn(
                new TokenBalanceService.TokenBalanceView(BUYER_WALLET, 7_000L, false, NOW)
        );

        mockMvc.perform(get("/api/battle-pass/premium/token/balance")
                        .header(PlayerHeaders.PLAYER_ID, "player-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.walletAddress").value(BUYER_WALLET))
                .andExpect(jsonPath("$.rawBalance").value(7000))
                .andExpect(jsonPath("$.stale").value(false));
    }

    private static PurchaseConfirmationWorkflow.PurchaseView view(UUID purchaseId, PurchaseStatus status, String signature) {
        return new PurchaseConfirmationWorkflow.PurchaseView(
                purchaseId,
                UUID.fromString("00000000-0000-0000-0000-0000000000aa"),
                3_000L,
                BUYER_WALLET,
                TREASURY_WALLET,
                status,
                signature,
                null,
                null,
                NOW,
                NOW.plusMinutes(5),
                NOW.plusSeconds(30),
                status.isTerminal() ? NOW.plusSeconds(60) : null
        );
    }
}
