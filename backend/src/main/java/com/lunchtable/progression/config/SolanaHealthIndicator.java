package com.lunchtable.progression.config;

import com.lunchtable.progression.service.ConfirmationLevel;
import com.lunchtable.progression.service.SolanaService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Token purchases need a reachable node, an existing mint and a usable confirmation setting.
 */
@Component
public class SolanaHealthIndicator implements HealthIndicator {

    private final SolanaService solanaService;
    private final ProgressionProperties progressionProperties;
    private final String treasuryWallet;

    public SolanaHealthIndicator(
            SolanaService solanaService,
            ProgressionProperties progressionProperties,
            @Qualifier("solanaTreasuryWallet") String treasuryWallet
    ) {
        this.solanaService = solanaService;
        this.progressionProperties = progressionProperties;
        this.treasuryWallet = treasuryWallet;
    }

    @Override
    public Health health() {
        String configuredLevel = progressionProperties.getPurchase().getRequiredConfirmation();
        ConfirmationLevel requiredConfirmation;
        try {
            requiredConfirmation = ConfirmationLevel.parse(configuredLevel);
        } catch (IllegalArgumentException e) {
            return Health.down()
                    .withDetail("requiredConfirmation", configuredLevel)
                    .withDetail("error", e.getMessage())
                    .build();
        }

        try {
            long slot = solanaService.getSlot();
            boolean mintExists = solanaService.tokenMintExists();
            return (mintExists ? Health.up() : Health.down())
                    .withDetail("slot", slot)
                    .withDetail("tokenMint", solanaService.getTokenMint())
                    .withDetail("tokenMintExists", mintExists)
                    .withDetail("treasuryWallet", treasuryWallet)
                    .withDetail("requiredConfirmation", requiredConfirmation.name().toLowerCase(Locale.ROOT))
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("tokenMint", solanaService.getTokenMint())
                    .withDetail("requiredConfirmation", requiredConfirmation.name().toLowerCase(Locale.ROOT))
                    .withException(e)
                    .build();
        }
    }
}
