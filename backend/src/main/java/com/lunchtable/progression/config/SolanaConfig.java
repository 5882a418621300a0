package com.lunchtable.progression.config;

import com.lunchtable.progression.service.SolanaService;
import org.p2p.solanaj.rpc.RpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RPC client plus the two addresses every token purchase is built against. Malformed addresses fail
 * startup rather than the first purchase.
 */
@Configuration
public class SolanaConfig {

    private static final Logger log = LoggerFactory.getLogger(SolanaConfig.class);

    @Bean
    public RpcClient solanaRpcClient(@Value("${solana.rpc.url}") String rpcUrl) {
        log.info("Using Solana RPC endpoint {}", rpcUrl);
        return new RpcClient(rpcUrl);
    }

    @Bean
    public String solanaTokenMint(@Value("${solana.token-mint}") String tokenMint) {
        return requirePublicKey("solana.token-mint", tokenMint);
    }

    @Bean
    public String solanaTreasuryWallet(@Value("${solana.treasury-wallet}") String treasuryWallet) {
        return requirePublicKey("solana.treasury-wallet", treasuryWallet);
    }

    static String requirePublicKey(String property, String value) {
        if (!SolanaService.isValidPublicKey(value)) {
            throw new IllegalStateException(property + " must be a base58 Solana public key, got '" + value + "'");
        }
        return value.trim();
    }
}
