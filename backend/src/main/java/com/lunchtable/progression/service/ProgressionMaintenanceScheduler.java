package com.lunchtable.progression.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Periodic upkeep: hourly sweep of expired unclaimed quests, the daily/weekly generation runs for
 * recently active players, and recovery of stalled purchase confirmation polls.
 */
@Service
public class ProgressionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(ProgressionMaintenanceScheduler.class);

    private final QuestGenerationService questGenerationService;
    private final PurchaseConfirmationWorkflow purchaseConfirmationWorkflow;

    public ProgressionMaintenanceScheduler(
            QuestGenerationService questGenerationService,
            PurchaseConfirmationWorkflow purchaseConfirmationWorkflow
    ) {
        this.questGenerationService = questGenerationService;
        this.purchaseConfirmationWorkflow = purchaseConfirmationWorkflow;
    }

    @Scheduled(
            fixedDelayString = "${progression.maintenance.quest-sweep-interval-ms:3600000}",
            initialDelayString = "${progression.scheduler.initial-delay-ms:5000}"
    )
    public void sweepExpiredQuests() {
        int deleted = questGenerationService.sweepExpiredQuests();
        log.debug("Quest sweep tick completed, deleted={}", deleted);
    }

    @Scheduled(
            fixedDelayString = "${progression.maintenance.purchase-sweep-interval-ms:30000}",
            initialDelayString = "${progression.scheduler.initial-delay-ms:5000}"
    )
    public void recoverStalledPurchasePolls() {
        int recovered = purchaseConfirmationWorkflow.recoverStalledPolls();
        if (recovered > 0) {
            log.info("Purchase sweep recovered {} stalled confirmation polls", recovered);
        }
    }

    @Scheduled(cron = "${progression.maintenance.daily-generation-cron:0 5 0 * * *}", zone = "UTC")
    public void generateDailyQuests() {
        GenerationSummary summary = generateForActivePlayers("daily", questGenerationService::generateDaily);
        log.info("Daily quest generation: players={}, questsCreated={}, failures={}",
                summary.players(), summary.questsCreated(), summary.failures());
    }

    @Scheduled(cron = "${progression.maintenance.weekly-generation-cron:0 10 0 * * MON}", zone = "UTC")
    public void generateWeeklyQuests() {
        GenerationSummary summary = generateForActivePlayers("weekly", questGenerationService::generateWeekly);
        log.info("Weekly quest generation: players={}, questsCreated={}, failures={}",
                summary.players(), summary.questsCreated(), summary.failures());
    }

    GenerationSummary generateForActivePlayers(String label, ToIntFunction<String> generator) {
        List<String> players = questGenerationService.findActivePlayers();
        int created = 0;
        int failures = 0;
        for (String userId : players) {
            try {
                created += generator.applyAsInt(userId);
            } catch (RuntimeException ex) {
                failures++;
                log.warn("Failed to generate {} quests for user {}: {}", label, userId, ex.getMessage());
            }
        }
        return new GenerationSummary(players.size(), created, failures);
    }

    record GenerationSummary(int players, int questsCreated, int failures) {
    }
}
