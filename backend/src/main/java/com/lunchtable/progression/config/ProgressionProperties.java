package com.lunchtable.progression.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Tunables for quests, the battle pass, the token purchase workflow and the deferred task worker.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "progression")
public class ProgressionProperties {

    private Quests quests = new Quests();
    private BattlePass battlePass = new BattlePass();
    private Economy economy = new Economy();
    private Purchase purchase = new Purchase();
    private Scheduler scheduler = new Scheduler();
    private Maintenance maintenance = new Maintenance();

    @Getter
    @Setter
    public static class Quests {
        private int dailyCount = 3;
        private int weeklyCount = 2;
        /**
         * Players whose stats were touched inside this window get daily/weekly quests generated.
         */
        private int activePlayerWindowDays = 30;
    }

    @Getter
    @Setter
    public static class BattlePass {
        private BigDecimal premiumXpMultiplier = new BigDecimal("1.5");
        private long winXp = 100;
        private long lossXp = 40;
    }

    @Getter
    @Setter
    public static class Economy {
        private long winGold = 25;
        private long lossGold = 10;
        /**
         * Platform cut taken from a settled wager pot, in basis points.
         */
        private int wagerFeeBasisPoints = 500;
    }

    @Getter
    @Setter
    public static class Purchase {
        private long intentTtlSeconds = 300;
        /**
         * Measured from purchase creation, not submission.
         */
        private long confirmationTimeoutSeconds = 420;
        private long pollDelayMs = 3_000;
        private long rpcErrorDelayMs = 5_000;
        private int maxNotFoundAttempts = 30;
        private int maxRpcErrorAttempts = 10;
        private String requiredConfirmation = "confirmed";
        private int rateLimitMaxInitiations = 5;
        private long rateLimitWindowSeconds = 600;
        /**
         * A submitted purchase with no poll for this long gets its poll chain restarted by the
         * maintenance sweep.
         */
        private long stalledPollSeconds = 60;
        private int stalledPollBatchSize = 50;
    }

    @Getter
    @Setter
    public static class Scheduler {
        private String mode = "jdbc";
        private long initialDelayMs = 5_000;
        private long pollIntervalMs = 1_000;
        private int batchSize = 25;
        private long leaseSeconds = 60;
        private int maxAttempts = 8;
        private long retryBackoffSeconds = 10;
        private String redisQueueKey = "progression:deferred-tasks";
        private String redisInflightKey = "progression:deferred-tasks:inflight";
    }

    @Getter
    @Setter
    public static class Maintenance {
        private long questSweepIntervalMs = 3_600_000;
        private long purchaseSweepIntervalMs = 30_000;
        private String dailyGenerationCron = "0 5 0 * * *";
        private String weeklyGenerationCron = "0 10 0 * * MON";
    }
}
