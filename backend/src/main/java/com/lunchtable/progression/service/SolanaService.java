package com.lunchtable.progression.service;

import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.rpc.RpcClient;
import org.p2p.solanaj.rpc.RpcException;
import org.p2p.solanaj.rpc.types.SignatureStatuses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SolanaService implements ChainSignatureClient {

    private static final Logger log = LoggerFactory.getLogger(SolanaService.class);

    private final RpcClient rpcClient;
    private final String tokenMint;

    public SolanaService(RpcClient rpcClient, @Qualifier("solanaTokenMint") String tokenMint) {
        this.rpcClient = rpcClient;
        this.tokenMint = tokenMint;
    }

    /**
     * Fetches the latest blockhash, used both as a connectivity check and for unsigned transfer payloads.
     *
     * @throws RpcException if the RPC call fails
     */
    public String getLatestBlockhash() throws RpcException {
        String blockhash = rpcClient.getApi().getLatestBlockhash().getValue().getBlockhash();
        log.debug("Latest blockhash: {}", blockhash);
        return blockhash;
    }

    /**
     * Checks whether the configured token mint account exists on-chain.
     */
    public boolean tokenMintExists() {
        try {
            var accountInfo = rpcClient.getApi().getAccountInfo(new PublicKey(tokenMint));
            boolean exists = accountInfo != null && accountInfo.getValue() != null;
            log.debug("Token mint {} exists: {}", tokenMint, exists);
            return exists;
        } catch (RpcException e) {
            log.error("Failed to check token mint account {}: {}", tokenMint, e.getMessage());
            return false;
        }
    }

    public long getSlot() throws RpcException {
        return rpcClient.getApi().getSlot();
    }

    /**
     * Looks the signature up with transaction history search enabled so older confirmations are found.
     */
    @Override
    public SignatureStatus getSignatureStatus(String signature) throws ChainRpcException {
        SignatureStatuses statuses;
        try {
            statuses = rpcClient.getApi().getSignatureStatuses(List.of(signature), true);
        } catch (RpcException e) {
            throw new ChainRpcException("getSignatureStatuses failed for " + signature + ": " + e.getMessage(), e);
        }
        if (statuses == null || statuses.getValue() == null || statuses.getValue().isEmpty()) {
            return SignatureStatus.notFound();
        }
        SignatureStatuses.Value value = statuses.getValue().get(0);
        if (value == null) {
            return SignatureStatus.notFound();
        }
        Object err = value.getErr();
        Long confirmations = value.getConfirmations();
        return new SignatureStatus(
                true,
                err == null ? null : String.valueOf(err),
                value.getConfirmationStatus(),
                confirmations
        );
    }

    /**
     * Raw token units held by the owner's token account for the configured mint.
     *
     * @throws ChainRpcException if the owner has no token account for the mint or the RPC call fails
     */
    public long getTokenBalance(String ownerWallet) throws ChainRpcException {
        PublicKey owner = new PublicKey(ownerWallet);
        try {
            PublicKey tokenAccount = rpcClient.getApi().getTokenAccountsByOwner(owner, new PublicKey(tokenMint));
            String amount = rpcClient.getApi().getTokenAccountBalance(tokenAccount).getAmount();
            long balance = Long.parseLong(amount);
            log.debug("Token balance for {}: {}", ownerWallet, balance);
            return balance;
        } catch (RpcException e) {
            throw new ChainRpcException("Token balance lookup failed for " + ownerWallet + ": " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new ChainRpcException("Unparseable token balance for " + ownerWallet, e);
        }
    }

    public String getTokenMint() {
        return tokenMint;
    }

    public static boolean isValidPublicKey(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        try {
            new PublicKey(address.trim());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
