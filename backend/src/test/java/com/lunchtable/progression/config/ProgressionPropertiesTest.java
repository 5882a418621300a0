package com.lunchtable.progression.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressionPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(ProgressionProperties.class);

    @Test
    void contextStartsWithProgressionPropertiesBean() {
        contextRunner.run(context -> assertTrue(context.containsBean("progressionProperties")));
    }

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            ProgressionProperties properties = context.getBean(ProgressionProperties.class);

            assertEquals(3, properties.getQuests().getDailyCount());
            assertEquals(2, properties.getQuests().getWeeklyCount());
            assertEquals(new BigDecimal("1.5"), properties.getBattlePass().getPremiumXpMultiplier());
            assertEquals(300L, properties.getPurchase().getIntentTtlSeconds());
            assertEquals(420L, properties.getPurchase().getConfirmationTimeoutSeconds());
            assertEquals(3_000L, properties.getPurchase().getPollDelayMs());
            assertEquals(5_000L, properties.getPurchase().getRpcErrorDelayMs());
            assertEquals(30, properties.getPurchase().getMaxNotFoundAttempts());
            assertEquals(10, properties.getPurchase().getMaxRpcErrorAttempts());
            assertEquals("confirmed", properties.getPurchase().getRequiredConfirmation());
            assertEquals("jdbc", properties.getScheduler().getMode());
            assertEquals("progression:deferred-tasks", properties.getScheduler().getRedisQueueKey());
            assertEquals(500, properties.getEconomy().getWagerFeeBasisPoints());
        });
    }

    @Test
    void bindsOverridesFromEnvironment() {
        contextRunner
                .withPropertyValues(
                        "progression.quests.daily-count=4",
                        "progression.battle-pass.premium-xp-multiplier=2.0",
                        "progression.purchase.confirmation-timeout-seconds=120",
                        "progression.purchase.required-confirmation=finalized",
                        "progression.scheduler.mode=redis",
                        "progression.scheduler.batch-size=5"
                )
                .run(context -> {
                    ProgressionProperties properties = context.getBean(ProgressionProperties.class);

                    assertEquals(4, properties.getQuests().getDailyCount());
                    assertEquals(new BigDecimal("2.0"), properties.getBattlePass().getPremiumXpMultiplier());
                    assertEquals(120L, properties.getPurchase().getConfirmationTimeoutSeconds());
                    assertEquals("finalized", properties.getPurchase().getRequiredConfirmation());
                    assertEquals("redis", properties.getScheduler().getMode());
                    assertEquals(5, properties.getScheduler().getBatchSize());
                });
    }
}
