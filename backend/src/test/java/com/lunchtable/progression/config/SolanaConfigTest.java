package com.lunchtable.progression.config;

import org.junit.jupiter.api.Test;
import org.p2p.solanaj.rpc.RpcClient;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SolanaConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(SolanaConfig.class);

    @Test
    void bindsEndpointAndTrimmedAddresses() {
        contextRunner
                .withPropertyValues(
                        "solana.rpc.url=https://api.devnet.solana.com",
                        "solana.token-mint= So11111111111111111111111111111111111111112 ",
                        "solana.treasury-wallet=9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(RpcClient.class);
                    assertEquals(
                            "So11111111111111111111111111111111111111112",
                            context.getBean("solanaTokenMint", String.class)
                    );
                    assertEquals(
                            "9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin",
                            context.getBean("solanaTreasuryWallet", String.class)
                    );
                });
    }

    @Test
    void malformedTreasuryWalletFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "solana.rpc.url=https://api.devnet.solana.com",
                        "solana.token-mint=So11111111111111111111111111111111111111112",
                        "solana.treasury-wallet=not-a-wallet"
                )
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void requirePublicKeyRejectsBlank() {
        assertThrows(IllegalStateException.class, () -> SolanaConfig.requirePublicKey("solana.token-mint", " "));
    }
}
