package com.lunchtable.progression.service;

import com.lunchtable.progression.config.ProgressionProperties;
import com.lunchtable.progression.model.ProgressCategory;
import com.lunchtable.progression.model.ProgressDefinition;
import com.lunchtable.progression.model.ProgressStatus;
import com.lunchtable.progression.repository.PlayerStatsRepository;
import com.lunchtable.progression.repository.ProgressDefinitionRepository;
import com.lunchtable.progression.repository.UserProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Assigns daily and weekly quests. Selection is a seeded shuffle of the active pool, so generating
 * twice for the same player and period always picks the same quests.
 */
@Service
public class QuestGenerationService {

    private static final Logger log = LoggerFactory.getLogger(QuestGenerationService.class);
    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final List<ProgressCategory> QUEST_CATEGORIES =
            List.of(ProgressCategory.DAILY_QUEST, ProgressCategory.WEEKLY_QUEST);

    private final ProgressDefinitionRepository progressDefinitionRepository;
    private final UserProgressRepository userProgressRepository;
    private final PlayerStatsRepository playerStatsRepository;
    private final ProgressionProperties progressionProperties;
    private final Clock clock;

    public QuestGenerationService(
            ProgressDefinitionRepository progressDefinitionRepository,
            UserProgressRepository userProgressRepository,
            PlayerStatsRepository playerStatsRepository,
            ProgressionProperties progressionProperties,
            Clock clock
    ) {
        this.progressDefinitionRepository = progressDefinitionRepository;
        this.userProgressRepository = userProgressRepository;
        this.playerStatsRepository = playerStatsRepository;
        this.progressionProperties = progressionProperties;
        this.clock = clock;
    }

    @Transactional
    public EnsureResult ensureUserHasQuests(String userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int daily = generateIfMissing(userId, ProgressCategory.DAILY_QUEST, now);
        int weekly = generateIfMissing(userId, ProgressCategory.WEEKLY_QUEST, now);
        return new EnsureResult(daily, weekly);
    }

    @Transactional
    public int generateDaily(String userId) {
        return generate(userId, ProgressCategory.DAILY_QUEST, OffsetDateTime.now(clock));
    }

    @Transactional
    public int generateWeekly(String userId) {
        return generate(userId, ProgressCategory.WEEKLY_QUEST, OffsetDateTime.now(clock));
    }

    private int generateIfMissing(String userId, ProgressCategory category, OffsetDateTime now) {
        String periodKey = periodKey(category, now.toInstant());
        if (!userProgressRepository.findByUserIdAndCategoryAndPeriodKey(userId, category, periodKey).isEmpty()) {
            return 0;
        }
        return generate(userId, category, now);
    }

    /**
     * @return number of quest rows inserted; rows that already exist for the period are left alone
     */
    private int generate(String userId, ProgressCategory category, OffsetDateTime now) {
        Instant instant = now.toInstant();
        String periodKey = periodKey(category, instant);
        OffsetDateTime expiresAt = periodEnd(category, instant);
        List<ProgressDefinition> pool =
                progressDefinitionRepository.findByCategoryAndActiveTrueOrderByDefinitionIdAsc(category);
        List<ProgressDefinition> selected = selectQuests(pool, userId + "-" + periodKey, countFor(category));

        int inserted = 0;
        for (ProgressDefinition definition : selected) {
            inserted += userProgressRepository.insertQuestIfAbsent(
                    UUID.randomUUID(),
                    userId,
                    definition.getDefinitionId(),
                    category.name(),
                    periodKey,
                    definition.getTargetValue(),
                    now,
                    expiresAt
            );
        }
        if (inserted > 0) {
            log.info("Generated {} {} quests for user {} period {}", inserted, category, userId, periodKey);
        }
        return inserted;
    }

    private int countFor(ProgressCategory category) {
        ProgressionProperties.Quests quests = progressionProperties.getQuests();
        return category == ProgressCategory.WEEKLY_QUEST ? quests.getWeeklyCount() : quests.getDailyCount();
    }

    static List<ProgressDefinition> selectQuests(List<ProgressDefinition> pool, String seed, int count) {
        if (pool.isEmpty() || count <= 0) {
            return List.of();
        }
        List<ProgressDefinition> shuffled = new ArrayList<>(pool);
        shuffled.sort(Comparator.comparing(ProgressDefinition::getDefinitionId));
        Collections.shuffle(shuffled, new Random(seed.hashCode()));
        return List.copyOf(shuffled.subList(0, Math.min(count, shuffled.size())));
    }

    /**
     * Daily keys are the UTC date; weekly keys are the ISO week ({@code 2026-W42}), Monday to Monday.
     */
    static String periodKey(ProgressCategory category, Instant instant) {
        if (category == ProgressCategory.WEEKLY_QUEST) {
            LocalDate weekStart = weekStart(instant);
            return String.format(
                    "%d-W%02d",
                    weekStart.get(IsoFields.WEEK_BASED_YEAR),
                    weekStart.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)
            );
        }
        if (category == ProgressCategory.DAILY_QUEST) {
            return LocalDate.ofInstant(instant, ZoneOffset.UTC).format(DAY_KEY);
        }
        throw new IllegalArgumentException("Not a quest category: " + category);
    }

    static OffsetDateTime periodEnd(ProgressCategory category, Instant instant) {
        if (category == ProgressCategory.WEEKLY_QUEST) {
            return weekStart(instant).plusWeeks(1).atStartOfDay().atOffset(ZoneOffset.UTC);
        }
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    private static LocalDate weekStart(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    @Transactional
    public int sweepExpiredQuests() {
        int deleted = userProgressRepository.deleteExpired(QUEST_CATEGORIES, OffsetDateTime.now(clock), ProgressStatus.CLAIMED);
        if (deleted > 0) {
            log.info("Swept {} expired unclaimed quests", deleted);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<String> findActivePlayers() {
        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(progressionProperties.getQuests().getActivePlayerWindowDays());
        return playerStatsRepository.findUserIdsActiveSince(since);
    }

    public record EnsureResult(int dailyGenerated, int weeklyGenerated) {
    }
}
