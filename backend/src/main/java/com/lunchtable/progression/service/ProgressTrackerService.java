package com.lunchtable.progression.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lunchtable.progression.model.ProgressCategory;
import com.lunchtable.progression.model.ProgressDefinition;
import com.lunchtable.progression.model.ProgressStatus;
import com.lunchtable.progression.model.Reward;
import com.lunchtable.progression.model.RewardJsonCodec;
import com.lunchtable.progression.model.RewardSource;
import com.lunchtable.progression.model.UserProgress;
import com.lunchtable.progression.model.NotificationKind;
import com.lunchtable.progression.repository.ProgressDefinitionRepository;
import com.lunchtable.progression.repository.UserProgressRepository;
import com.lunchtable.progression.web.ProgressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Matches progress events against quest and achievement definitions and grants their rewards.
 * <p>
 * Progress is clamped to the target and never decreases. Quests complete and wait to be claimed;
 * achievements unlock and pay out in the same transaction, after which their progress is frozen.
 */
@Service
public class ProgressTrackerService {

    private static final Logger log = LoggerFactory.getLogger(ProgressTrackerService.class);
    private static final List<ProgressCategory> QUEST_CATEGORIES =
            List.of(ProgressCategory.DAILY_QUEST, ProgressCategory.WEEKLY_QUEST);

    private final ProgressDefinitionRepository progressDefinitionRepository;
    private final UserProgressRepository userProgressRepository;
    private final RewardLedger rewardLedger;
    private final BattlePassService battlePassService;
    private final NotificationService notificationService;
    private final Clock clock;

    public ProgressTrackerService(
            ProgressDefinitionRepository progressDefinitionRepository,
            UserProgressRepository userProgressRepository,
            RewardLedger rewardLedger,
            BattlePassService battlePassService,
            NotificationService notificationService,
            Clock clock
    ) {
        this.progressDefinitionRepository = progressDefinitionRepository;
        this.userProgressRepository = userProgressRepository;
        this.rewardLedger = rewardLedger;
        this.battlePassService = battlePassService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @Transactional
    public MatchSummary matchEvent(String userId, ProgressEvent event) {
        Objects.requireNonNull(event, "event is required");
        if (event.value() <= 0) {
            return MatchSummary.none();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);

        int questsAdvanced = 0;
        int questsCompleted = 0;
        List<UserProgress> openQuests =
                userProgressRepository.findOpenQuestsForUpdate(userId, QUEST_CATEGORIES, ProgressStatus.ACTIVE, now);
        if (!openQuests.isEmpty()) {
            Map<String, ProgressDefinition> definitions = definitionsById(openQuests);
            for (UserProgress quest : openQuests) {
                ProgressDefinition definition = definitions.get(quest.getDefinitionId());
                if (definition == null || !definition.matches(event.kind(), event.gameMode(), event.archetype())) {
                    continue;
                }
                questsAdvanced++;
                if (advance(quest, event.value(), now)) {
                    quest.setStatus(ProgressStatus.COMPLETED);
                    quest.setCompletedAt(now);
                    questsCompleted++;
                    notificationService.notifyPlayer(
                            userId,
                            NotificationKind.QUEST_COMPLETED,
                            quest.getDefinitionId() + ":" + quest.getPeriodKey(),
                            "Quest complete: " + definition.getName(),
                            "Claim your reward for \"" + definition.getDescription() + "\".",
                            questData(quest)
                    );
                }
                userProgressRepository.save(quest);
            }
        }

        int achievementsAdvanced = 0;
        int achievementsUnlocked = 0;
        long xpGranted = 0;
        List<ProgressDefinition> achievements =
                progressDefinitionRepository.findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory.ACHIEVEMENT);
        for (ProgressDefinition definition : achievements) {
            if (!definition.matches(event.kind(), event.gameMode(), event.archetype())) {
                continue;
            }
            userProgressRepository.insertAchievementIfAbsent(
                    UUID.randomUUID(),
                    userId,
                    definition.getDefinitionId(),
                    definition.getTargetValue(),
                    now
            );
            UserProgress achievement = userProgressRepository
                    .findByUserIdAndDefinitionIdAndPeriodKeyForUpdate(userId, definition.getDefinitionId(), UserProgress.PERMANENT_PERIOD)
                    .orElseThrow(() -> new IllegalStateException(
                            "Achievement progress missing after insert: " + definition.getDefinitionId()
                    ));
            if (achievement.getStatus() == ProgressStatus.UNLOCKED) {
                continue;
            }
            achievementsAdvanced++;
            if (advance(achievement, event.value(), now)) {
                achievement.setStatus(ProgressStatus.UNLOCKED);
                achievement.setUnlockedAt(now);
                achievementsUnlocked++;
                xpGranted += unlockAchievement(userId, definition, achievement);
            }
            userProgressRepository.save(achievement);
        }

        if (xpGranted > 0) {
            battlePassService.addXpToActiveSeason(userId, xpGranted);
        }
        return new MatchSummary(questsAdvanced, questsCompleted, achievementsAdvanced, achievementsUnlocked, xpGranted);
    }

    /**
     * @return true when this step reached the target
     */
    private static boolean advance(UserProgress progress, int value, OffsetDateTime now) {
        int target = progress.getTargetValue();
        int before = progress.getCurrentProgress();
        int after = (int) Math.min((long) before + value, target);
        progress.setCurrentProgress(Math.max(before, after));
        progress.setUpdatedAt(now);
        return before < target && after >= target;
    }

    private long unlockAchievement(String userId, ProgressDefinition definition, UserProgress achievement) {
        List<Reward> rewards = RewardJsonCodec.fromJson(definition.getRewardsJson());
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("definitionId", definition.getDefinitionId());
        if (definition.getRarity() != null) {
            metadata.put("rarity", definition.getRarity().name());
        }
        RewardLedger.RewardGrant grant = rewardLedger.applyRewards(
                userId,
                rewards,
                RewardSource.ACHIEVEMENT,
                "achievement:" + definition.getDefinitionId(),
                metadata
        );
        notificationService.notifyPlayer(
                userId,
                NotificationKind.ACHIEVEMENT_UNLOCKED,
                definition.getDefinitionId(),
                "Achievement unlocked: " + definition.getName(),
                definition.getDescription(),
                questData(achievement)
        );
        log.info("User {} unlocked achievement {}", userId, definition.getDefinitionId());
        return grant.xp();
    }

    @Transactional
    public QuestClaimResult claimReward(String userId, UUID questRecordId) {
        UserProgress quest = userProgressRepository.findByProgressIdForUpdate(questRecordId)
                .orElseThrow(() -> ProgressionException.notFound("quest_not_found", "Quest not found: " + questRecordId));
        if (!quest.getUserId().equals(userId)) {
            throw ProgressionException.forbidden("Quest belongs to another player");
        }
        if (!quest.getCategory().isQuest()) {
            throw ProgressionException.validation("not_a_quest", "Achievements are rewarded on unlock");
        }
        if (quest.getStatus() == ProgressStatus.CLAIMED) {
            throw ProgressionException.conflict("already_claimed", "Quest reward already claimed");
        }
        if (quest.getStatus() != ProgressStatus.COMPLETED) {
            throw ProgressionException.validation(
                    "quest_not_completed",
                    "Quest progress " + quest.getCurrentProgress() + "/" + quest.getTargetValue()
            );
        }

        ProgressDefinition definition = progressDefinitionRepository.findById(quest.getDefinitionId())
                .orElseThrow(() -> new IllegalStateException("Quest definition missing: " + quest.getDefinitionId()));
        List<Reward> rewards = RewardJsonCodec.fromJson(definition.getRewardsJson());
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("definitionId", definition.getDefinitionId());
        metadata.put("periodKey", quest.getPeriodKey());
        RewardLedger.RewardGrant grant = rewardLedger.applyRewards(
                userId,
                rewards,
                RewardSource.QUEST,
                "quest:" + quest.getProgressId(),
                metadata
        );

        OffsetDateTime now = OffsetDateTime.now(clock);
        quest.setStatus(ProgressStatus.CLAIMED);
        quest.setClaimedAt(now);
        quest.setUpdatedAt(now);
        userProgressRepository.save(quest);

        if (grant.xp() > 0) {
            battlePassService.addXpToActiveSeason(userId, grant.xp());
        }
        log.info("User {} claimed quest {} ({})", userId, quest.getProgressId(), definition.getDefinitionId());
        return new QuestClaimResult(quest.getProgressId(), definition.getDefinitionId(), rewards, grant);
    }

    @Transactional(readOnly = true)
    public List<ProgressView> listQuests(String userId) {
        List<UserProgress> quests =
                userProgressRepository.findCurrentQuests(userId, QUEST_CATEGORIES, OffsetDateTime.now(clock));
        Map<String, ProgressDefinition> definitions = definitionsById(quests);
        return quests.stream()
                .filter(quest -> definitions.containsKey(quest.getDefinitionId()))
                .map(quest -> ProgressView.of(quest, definitions.get(quest.getDefinitionId()), false))
                .toList();
    }

    /**
     * All achievements with the player's progress. Secret ones are masked until unlocked.
     */
    @Transactional(readOnly = true)
    public List<ProgressView> listAchievements(String userId) {
        Map<String, UserProgress> progressByDefinition = userProgressRepository
                .findByUserIdAndCategory(userId, ProgressCategory.ACHIEVEMENT)
                .stream()
                .collect(Collectors.toMap(UserProgress::getDefinitionId, Function.identity()));

        return progressDefinitionRepository
                .findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory.ACHIEVEMENT)
                .stream()
                .map(definition -> {
                    UserProgress progress = progressByDefinition.get(definition.getDefinitionId());
                    boolean unlocked = progress != null && progress.getStatus() == ProgressStatus.UNLOCKED;
                    boolean hidden = definition.isSecret() && !unlocked;
                    return progress == null
                            ? ProgressView.locked(definition, hidden)
                            : ProgressView.of(progress, definition, hidden);
                })
                .sorted(Comparator.comparing(ProgressView::unlocked).reversed())
                .toList();
    }

    private Map<String, ProgressDefinition> definitionsById(List<UserProgress> rows) {
        List<String> ids = rows.stream().map(UserProgress::getDefinitionId).distinct().toList();
        if (ids.isEmpty()) {
            return Map.of();
        }
        return progressDefinitionRepository.findByDefinitionIdIn(ids)
                .stream()
                .collect(Collectors.toMap(ProgressDefinition::getDefinitionId, Function.identity()));
    }

    private static JsonNode questData(UserProgress progress) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("definitionId", progress.getDefinitionId());
        data.put("periodKey", progress.getPeriodKey());
        if (progress.getProgressId() != null) {
            data.put("progressId", progress.getProgressId().toString());
        }
        return data;
    }

    public record MatchSummary(
            int questsAdvanced,
            int questsCompleted,
            int achievementsAdvanced,
            int achievementsUnlocked,
            long battlePassXp
    ) {
        public static MatchSummary none() {
            return new MatchSummary(0, 0, 0, 0, 0);
        }
    }

    public record QuestClaimResult(
            UUID progressId,
            String definitionId,
            List<Reward> rewards,
            RewardLedger.RewardGrant grant
    ) {
    }

    public record ProgressView(
            UUID progressId,
            String definitionId,
            ProgressCategory category,
            String name,
            String description,
            int currentProgress,
            int targetValue,
            ProgressStatus status,
            String rarity,
            boolean secret,
            boolean unlocked,
            JsonNode rewards,
            OffsetDateTime expiresAt,
            OffsetDateTime completedAt
    ) {
        private static final String HIDDEN_NAME = "???";
        private static final String HIDDEN_DESCRIPTION = "Secret achievement";

        static ProgressView of(UserProgress progress, ProgressDefinition definition, boolean hidden) {
            return new ProgressView(
                    progress.getProgressId(),
                    definition.getDefinitionId(),
                    definition.getCategory(),
                    hidden ? HIDDEN_NAME : definition.getName(),
                    hidden ? HIDDEN_DESCRIPTION : definition.getDescription(),
                    progress.getCurrentProgress(),
                    progress.getTargetValue(),
                    progress.getStatus(),
                    definition.getRarity() == null ? null : definition.getRarity().name(),
                    definition.isSecret(),
                    progress.getStatus() == ProgressStatus.UNLOCKED,
                    hidden ? null : definition.getRewardsJson(),
                    progress.getExpiresAt(),
                    progress.getStatus() == ProgressStatus.UNLOCKED ? progress.getUnlockedAt() : progress.getCompletedAt()
            );
        }

        static ProgressView locked(ProgressDefinition definition, boolean hidden) {
            return new ProgressView(
                    null,
                    definition.getDefinitionId(),
                    definition.getCategory(),
                    hidden ? HIDDEN_NAME : definition.getName(),
                    hidden ? HIDDEN_DESCRIPTION : definition.getDescription(),
                    0,
                    definition.getTargetValue(),
                    ProgressStatus.LOCKED,
                    definition.getRarity() == null ? null : definition.getRarity().name(),
                    definition.isSecret(),
                    false,
                    hidden ? null : definition.getRewardsJson(),
                    null,
                    null
            );
        }
    }
}
