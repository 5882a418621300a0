package com.lunchtable.progression.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.p2p.solanaj.rpc.RpcClient;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Devnet connectivity checks.
 *
 * Run with:
 *   SOLANA_TEST_DEVNET=true mvn test
 */
@EnabledIfEnvironmentVariable(named = "SOLANA_TEST_DEVNET", matches = "true")
class SolanaServiceTest {

    private static final String DEVNET_RPC = "https://api.devnet.solana.com";
    private static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";
    private static final String UNKNOWN_SIGNATURE =
            "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW";

    private SolanaService solanaService;

    @BeforeEach
    void setUp() {
        solanaService = new SolanaService(new RpcClient(DEVNET_RPC), WRAPPED_SOL_MINT);
    }

    @Test
    void getLatestBlockhash_returnsValidHash() throws Exception {
        String blockhash = solanaService.getLatestBlockhash();
        assertNotNull(blockhash, "Blockhash should not be null");
        assertFalse(blockhash.isBlank(), "Blockhash should not be blank");
    }

    @Test
    void getSlot_returnsPositiveNumber() throws Exception {
        long slot = solanaService.getSlot();
        assertTrue(slot > 0, "Slot should be positive, got: " + slot);
    }

    @Test
    void tokenMintExists_returnsTrueForWrappedSol() {
        assertTrue(solanaService.tokenMintExists(), "Mint " + WRAPPED_SOL_MINT + " should exist on devnet");
    }

    @Test
    void getSignatureStatus_reportsUnknownSignatureAsNotFound() throws Exception {
        SignatureStatus status = solanaService.getSignatureStatus(UNKNOWN_SIGNATURE);
        assertFalse(status.found());
    }
}
