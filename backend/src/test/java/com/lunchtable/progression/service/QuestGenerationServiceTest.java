package com.lunchtable.progression.service;

import com.lunchtable.progression.config.ProgressionProperties;
import com.lunchtable.progression.model.ProgressCategory;
import com.lunchtable.progression.model.ProgressDefinition;
import com.lunchtable.progression.model.ProgressStatus;
import com.lunchtable.progression.model.RequirementKind;
import com.lunchtable.progression.model.UserProgress;
import com.lunchtable.progression.repository.PlayerStatsRepository;
import com.lunchtable.progression.repository.ProgressDefinitionRepository;
import com.lunchtable.progression.repository.UserProgressRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuestGenerationServiceTest {

    private static final String USER_ID = "player-1";
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Mock
    private ProgressDefinitionRepository progressDefinitionRepository;

    @Mock
    private UserProgressRepository userProgressRepository;

    @Mock
    private PlayerStatsRepository playerStatsRepository;

    private ProgressionProperties progressionProperties;
    private QuestGenerationService questGenerationService;

    @BeforeEach
    void setUp() {
        progressionProperties = new ProgressionProperties();
        questGenerationService = new QuestGenerationService(
                progressDefinitionRepository,
                userProgressRepository,
                playerStatsRepository,
                progressionProperties,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void selectionIsDeterministicForSeedRegardlessOfPoolOrder() {
        List<ProgressDefinition> pool = pool(8);
        List<ProgressDefinition> reversed = new ArrayList<>(pool);
        Collections.reverse(reversed);

        List<String> first = ids(QuestGenerationService.selectQuests(pool, "player-1-2026-03-02", 3));
        List<String> second = ids(QuestGenerationService.selectQuests(reversed, "player-1-2026-03-02", 3));

        assertEquals(3, first.size());
        assertEquals(first, second);
        assertEquals(3, first.stream().distinct().count());
    }

    @Test
    void selectionIsCappedByPoolSize() {
        assertEquals(2, QuestGenerationService.selectQuests(pool(2), "seed", 5).size());
        assertTrue(QuestGenerationService.selectQuests(List.of(), "seed", 3).isEmpty());
        assertTrue(QuestGenerationService.selectQuests(pool(4), "seed", 0).isEmpty());
    }

    @Test
    void dailyPeriodUsesUtcCalendarDay() {
        Instant lateEvening = Instant.parse("2026-03-02T23:59:59Z");

        assertEquals("2026-03-02", QuestGenerationService.periodKey(ProgressCategory.DAILY_QUEST, lateEvening));
        assertEquals(
                OffsetDateTime.parse("2026-03-03T00:00:00Z"),
                QuestGenerationService.periodEnd(ProgressCategory.DAILY_QUEST, lateEvening)
        );
    }

    @Test
    void weeklyPeriodRunsMondayToMonday() {
        Instant mondayRun = Instant.parse("2026-10-12T00:10:00Z");

        assertEquals("2026-W42", QuestGenerationService.periodKey(ProgressCategory.WEEKLY_QUEST, mondayRun));
        OffsetDateTime end = QuestGenerationService.periodEnd(ProgressCategory.WEEKLY_QUEST, mondayRun);
        assertEquals(OffsetDateTime.parse("2026-10-19T00:00:00Z"), end);
        assertEquals(DayOfWeek.MONDAY, end.getDayOfWeek());

        Instant sundayNight = Instant.parse("2026-10-18T23:59:59Z");
        assertEquals("2026-W42", QuestGenerationService.periodKey(ProgressCategory.WEEKLY_QUEST, sundayNight));
        assertEquals(end, QuestGenerationService.periodEnd(ProgressCategory.WEEKLY_QUEST, sundayNight));
    }

    @Test
    void weeklyPeriodUsesWeekBasedYearAcrossNewYear() {
        Instant newYearsDay = Instant.parse("2027-01-01T09:00:00Z");

        assertEquals("2026-W53", QuestGenerationService.periodKey(ProgressCategory.WEEKLY_QUEST, newYearsDay));
        assertEquals(
                OffsetDateTime.parse("2027-01-04T00:00:00Z"),
                QuestGenerationService.periodEnd(ProgressCategory.WEEKLY_QUEST, newYearsDay)
        );
    }

    @Test
    void mondayWeeklyGenerationExpiresTheFollowingMonday() {
        Instant mondayRun = Instant.parse("2026-10-12T00:10:00Z");
        QuestGenerationService mondayService = new QuestGenerationService(
                progressDefinitionRepository,
                userProgressRepository,
                playerStatsRepository,
                progressionProperties,
                Clock.fixed(mondayRun, ZoneOffset.UTC)
        );
        when(progressDefinitionRepository.findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory.WEEKLY_QUEST))
                .thenReturn(pool(5));
        when(userProgressRepository.insertQuestIfAbsent(
                any(), eq(USER_ID), anyString(), eq("WEEKLY_QUEST"), eq("2026-W42"), anyInt(), any(), any()
        )).thenReturn(1);

        assertEquals(2, mondayService.generateWeekly(USER_ID));
        verify(userProgressRepository, times(2)).insertQuestIfAbsent(
                any(),
                eq(USER_ID),
                anyString(),
                eq("WEEKLY_QUEST"),
                eq("2026-W42"),
                anyInt(),
                eq(OffsetDateTime.ofInstant(mondayRun, ZoneOffset.UTC)),
                eq(OffsetDateTime.parse("2026-10-19T00:00:00Z"))
        );
    }

    @Test
    void achievementsHaveNoQuestPeriod() {
        assertThrows(
                IllegalArgumentException.class,
                () -> QuestGenerationService.periodKey(ProgressCategory.ACHIEVEMENT, NOW)
        );
    }

    @Test
    void ensureGeneratesOnlyMissingPeriods() {
        String weeklyKey = QuestGenerationService.periodKey(ProgressCategory.WEEKLY_QUEST, NOW);
        when(userProgressRepository.findByUserIdAndCategoryAndPeriodKey(USER_ID, ProgressCategory.DAILY_QUEST, "2026-03-02"))
                .thenReturn(List.of());
        when(userProgressRepository.findByUserIdAndCategoryAndPeriodKey(USER_ID, ProgressCategory.WEEKLY_QUEST, weeklyKey))
                .thenReturn(List.of(new UserProgress()));
        when(progressDefinitionRepository.findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory.DAILY_QUEST))
                .thenReturn(pool(6));
        when(userProgressRepository.insertQuestIfAbsent(
                any(), eq(USER_ID), anyString(), eq("DAILY_QUEST"), eq("2026-03-02"), anyInt(), any(), any()
        )).thenReturn(1);

        QuestGenerationService.EnsureResult result = questGenerationService.ensureUserHasQuests(USER_ID);

        assertEquals(3, result.dailyGenerated());
        assertEquals(0, result.weeklyGenerated());
        verify(userProgressRepository, times(3)).insertQuestIfAbsent(
                any(),
                eq(USER_ID),
                anyString(),
                eq("DAILY_QUEST"),
                eq("2026-03-02"),
                anyInt(),
                eq(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)),
                eq(OffsetDateTime.parse("2026-03-03T00:00:00Z"))
        );
        verify(progressDefinitionRepository, never())
                .findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory.WEEKLY_QUEST);
    }

    @Test
    void regenerationCountsOnlyNewRows() {
        progressionProperties.getQuests().setWeeklyCount(2);
        when(progressDefinitionRepository.findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory.WEEKLY_QUEST))
                .thenReturn(pool(5));
        when(userProgressRepository.insertQuestIfAbsent(
                any(), eq(USER_ID), anyString(), eq("WEEKLY_QUEST"), anyString(), anyInt(), any(), any()
        )).thenReturn(0);

        assertEquals(0, questGenerationService.generateWeekly(USER_ID));
    }

    @Test
    void sweepRemovesExpiredUnclaimedQuests() {
        when(userProgressRepository.deleteExpired(
                List.of(ProgressCategory.DAILY_QUEST, ProgressCategory.WEEKLY_QUEST),
                OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC),
                ProgressStatus.CLAIMED
        )).thenReturn(4);

        assertEquals(4, questGenerationService.sweepExpiredQuests());
    }

    @Test
    void activePlayersComeFromConfiguredWindow() {
        progressionProperties.getQuests().setActivePlayerWindowDays(7);
        when(playerStatsRepository.findUserIdsActiveSince(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusDays(7)))
                .thenReturn(List.of("player-1", "player-2"));

        assertEquals(List.of("player-1", "player-2"), questGenerationService.findActivePlayers());
    }

    private static List<ProgressDefinition> pool(int size) {
        return IntStream.range(0, size)
                .mapToObj(index -> {
                    ProgressDefinition definition = new ProgressDefinition();
                    definition.setDefinitionId("quest_" + index);
                    definition.setCategory(ProgressCategory.DAILY_QUEST);
                    definition.setRequirementKind(RequirementKind.PLAY_GAME);
                    definition.setTargetValue(3);
                    return definition;
                })
                .toList();
    }

    private static List<String> ids(List<ProgressDefinition> definitions) {
        return definitions.stream().map(ProgressDefinition::getDefinitionId).toList();
    }
}
