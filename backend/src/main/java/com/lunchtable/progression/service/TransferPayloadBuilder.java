package com.lunchtable.progression.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.p2p.solanaj.rpc.RpcException;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.UUID;

/**
 * Describes the unsigned token transfer the buyer's wallet must sign, as base64-encoded JSON.
 * The wallet builds and signs the actual transaction from this description.
 */
@Component
@RequiredArgsConstructor
public class TransferPayloadBuilder {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();
    static final int PAYLOAD_VERSION = 1;

    private final SolanaService solanaService;

    public String build(
            UUID purchaseId,
            String buyerWallet,
            String treasuryWallet,
            String tokenMint,
            long rawAmount
    ) throws ChainRpcException {
        String recentBlockhash;
        try {
            recentBlockhash = solanaService.getLatestBlockhash();
        } catch (RpcException e) {
            throw new ChainRpcException("Failed to fetch recent blockhash: " + e.getMessage(), e);
        }

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("version", PAYLOAD_VERSION);
        payload.put("kind", "spl_token_transfer");
        payload.put("source", buyerWallet);
        payload.put("destination", treasuryWallet);
        payload.put("mint", tokenMint);
        payload.put("amount", rawAmount);
        payload.put("recentBlockhash", recentBlockhash);
        payload.put("memo", "premium-pass:" + purchaseId);
        try {
            byte[] json = OBJECT_MAPPER.writeValueAsBytes(payload);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode transfer payload", e);
        }
    }
}
