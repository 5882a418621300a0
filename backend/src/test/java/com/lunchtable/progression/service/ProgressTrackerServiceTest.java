package com.lunchtable.progression.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lunchtable.progression.model.AchievementRarity;
import com.lunchtable.progression.model.GameMode;
import com.lunchtable.progression.model.NotificationKind;
import com.lunchtable.progression.model.ProgressCategory;
import com.lunchtable.progression.model.ProgressDefinition;
import com.lunchtable.progression.model.ProgressStatus;
import com.lunchtable.progression.model.RequirementKind;
import com.lunchtable.progression.model.RewardSource;
import com.lunchtable.progression.model.UserProgress;
import com.lunchtable.progression.repository.ProgressDefinitionRepository;
import com.lunchtable.progression.repository.UserProgressRepository;
import com.lunchtable.progression.web.ProgressionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressTrackerServiceTest {

    private static final String USER_ID = "player-1";
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Mock
    private ProgressDefinitionRepository progressDefinitionRepository;

    @Mock
    private UserProgressRepository userProgressRepository;

    @Mock
    private RewardLedger rewardLedger;

    @Mock
    private BattlePassService battlePassService;

    @Mock
    private NotificationService notificationService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ProgressTrackerService progressTrackerService;

    @BeforeEach
    void setUp() {
        progressTrackerService = new ProgressTrackerService(
                progressDefinitionRepository,
                userProgressRepository,
                rewardLedger,
                battlePassService,
                notificationService,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void questProgressIsClampedAndCompletesOnlyOnce() throws Exception {
        ProgressDefinition definition = definition("daily_win_10", ProgressCategory.DAILY_QUEST, RequirementKind.WIN_GAME, 10);
        UserProgress quest = quest(definition, ProgressStatus.ACTIVE, 0);
        when(userProgressRepository.findOpenQuestsForUpdate(eq(USER_ID), anyCollection(), eq(ProgressStatus.ACTIVE), any()))
                .thenReturn(List.of(quest));
        when(progressDefinitionRepository.findByDefinitionIdIn(anyCollection())).thenReturn(List.of(definition));

        ProgressEvent winByFour = new ProgressEvent(RequirementKind.WIN_GAME, 4, GameMode.CASUAL, null);
        ProgressTrackerService.MatchSummary first = progressTrackerService.matchEvent(USER_ID, winByFour);
        ProgressTrackerService.MatchSummary second = progressTrackerService.matchEvent(USER_ID, winByFour);
        ProgressTrackerService.MatchSummary third = progressTrackerService.matchEvent(USER_ID, winByFour);

        assertEquals(0, first.questsCompleted());
        assertEquals(0, second.questsCompleted());
        assertEquals(1, third.questsCompleted());
        assertEquals(10, quest.getCurrentProgress());
        assertEquals(ProgressStatus.COMPLETED, quest.getStatus());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), quest.getCompletedAt());
        verify(notificationService, times(1))
                .notifyPlayer(eq(USER_ID), eq(NotificationKind.QUEST_COMPLETED), eq("daily_win_10:2026-03-02"), anyString(), anyString(), any());
        verify(rewardLedger, never()).applyRewards(anyString(), anyList(), any(), anyString(), any());
    }

    @Test
    void questsWithNonMatchingFiltersAreUntouched() throws Exception {
        ProgressDefinition definition = definition("daily_ranked", ProgressCategory.DAILY_QUEST, RequirementKind.PLAY_GAME, 3);
        definition.setGameModeFilter(GameMode.RANKED);
        UserProgress quest = quest(definition, ProgressStatus.ACTIVE, 1);
        when(userProgressRepository.findOpenQuestsForUpdate(eq(USER_ID), anyCollection(), eq(ProgressStatus.ACTIVE), any()))
                .thenReturn(List.of(quest));
        when(progressDefinitionRepository.findByDefinitionIdIn(anyCollection())).thenReturn(List.of(definition));

        ProgressTrackerService.MatchSummary summary =
                progressTrackerService.matchEvent(USER_ID, ProgressEvent.of(RequirementKind.PLAY_GAME, GameMode.CASUAL, null));

        assertEquals(0, summary.questsAdvanced());
        assertEquals(1, quest.getCurrentProgress());
        verify(userProgressRepository, never()).save(any());
    }

    @Test
    void retiredQuestDefinitionNoLongerAdvancesExistingQuests() throws Exception {
        ProgressDefinition definition = definition("daily_win_10", ProgressCategory.DAILY_QUEST, RequirementKind.WIN_GAME, 10);
        definition.setActive(false);
        UserProgress quest = quest(definition, ProgressStatus.ACTIVE, 9);
        when(userProgressRepository.findOpenQuestsForUpdate(eq(USER_ID), anyCollection(), eq(ProgressStatus.ACTIVE), any()))
                .thenReturn(List.of(quest));
        when(progressDefinitionRepository.findByDefinitionIdIn(anyCollection())).thenReturn(List.of(definition));

        ProgressTrackerService.MatchSummary summary =
                progressTrackerService.matchEvent(USER_ID, ProgressEvent.of(RequirementKind.WIN_GAME, GameMode.CASUAL, null));

        assertEquals(0, summary.questsAdvanced());
        assertEquals(9, quest.getCurrentProgress());
        assertEquals(ProgressStatus.ACTIVE, quest.getStatus());
        verify(userProgressRepository, never()).save(any());
        verify(notificationService, never())
                .notifyPlayer(anyString(), any(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void achievementUnlocksOnceAndIsFrozenAfterwards() throws Exception {
        ProgressDefinition definition = definition("first_win", ProgressCategory.ACHIEVEMENT, RequirementKind.WIN_GAME, 1);
        definition.setRarity(AchievementRarity.COMMON);
        definition.setRewardsJson(objectMapper.readTree("[{\"type\":\"GOLD\",\"amount\":50},{\"type\":\"XP\",\"amount\":75}]"));
        UserProgress achievement = quest(definition, ProgressStatus.LOCKED, 0);
        achievement.setCategory(ProgressCategory.ACHIEVEMENT);
        achievement.setPeriodKey(UserProgress.PERMANENT_PERIOD);
        when(progressDefinitionRepository.findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory.ACHIEVEMENT))
                .thenReturn(List.of(definition));
        when(userProgressRepository.findByUserIdAndDefinitionIdAndPeriodKeyForUpdate(USER_ID, "first_win", UserProgress.PERMANENT_PERIOD))
                .thenReturn(Optional.of(achievement));
        when(rewardLedger.applyRewards(eq(USER_ID), anyList(), eq(RewardSource.ACHIEVEMENT), eq("achievement:first_win"), any()))
                .thenReturn(new RewardLedger.RewardGrant(50, 0, 75, List.of()));

        ProgressEvent win = ProgressEvent.of(RequirementKind.WIN_GAME, GameMode.RANKED, "dragons");
        ProgressTrackerService.MatchSummary first = progressTrackerService.matchEvent(USER_ID, win);
        ProgressTrackerService.MatchSummary second = progressTrackerService.matchEvent(USER_ID, win);

        assertEquals(1, first.achievementsUnlocked());
        assertEquals(75L, first.battlePassXp());
        assertEquals(0, second.achievementsAdvanced());
        assertEquals(ProgressStatus.UNLOCKED, achievement.getStatus());
        assertEquals(1, achievement.getCurrentProgress());
        verify(rewardLedger, times(1)).applyRewards(eq(USER_ID), anyList(), eq(RewardSource.ACHIEVEMENT), anyString(), any());
        verify(battlePassService, times(1)).addXpToActiveSeason(USER_ID, 75L);
        verify(notificationService, times(1))
                .notifyPlayer(eq(USER_ID), eq(NotificationKind.ACHIEVEMENT_UNLOCKED), eq("first_win"), anyString(), anyString(), any());
    }

    @Test
    void nonPositiveEventValueChangesNothing() {
        ProgressTrackerService.MatchSummary summary =
                progressTrackerService.matchEvent(USER_ID, new ProgressEvent(RequirementKind.WIN_GAME, 0, null, null));

        assertEquals(ProgressTrackerService.MatchSummary.none(), summary);
        verify(userProgressRepository, never()).findOpenQuestsForUpdate(anyString(), anyCollection(), any(), any());
    }

    @Test
    void claimRewardGrantsAndFeedsBattlePassXp() throws Exception {
        ProgressDefinition definition = definition("daily_play_3", ProgressCategory.DAILY_QUEST, RequirementKind.PLAY_GAME, 3);
        definition.setRewardsJson(objectMapper.readTree("[{\"type\":\"GOLD\",\"amount\":60},{\"type\":\"XP\",\"amount\":40}]"));
        UserProgress quest = quest(definition, ProgressStatus.COMPLETED, 3);
        when(userProgressRepository.findByProgressIdForUpdate(quest.getProgressId())).thenReturn(Optional.of(quest));
        when(progressDefinitionRepository.findById("daily_play_3")).thenReturn(Optional.of(definition));
        when(rewardLedger.applyRewards(
                eq(USER_ID),
                anyList(),
                eq(RewardSource.QUEST),
                eq("quest:" + quest.getProgressId()),
                any()
        )).thenReturn(new RewardLedger.RewardGrant(60, 0, 40, List.of()));

        ProgressTrackerService.QuestClaimResult result = progressTrackerService.claimReward(USER_ID, quest.getProgressId());

        assertEquals(2, result.rewards().size());
        assertEquals(60L, result.grant().gold());
        assertEquals(ProgressStatus.CLAIMED, quest.getStatus());
        verify(battlePassService).addXpToActiveSeason(USER_ID, 40L);
    }

    @Test
    void claimRewardRejectsIncompleteQuest() throws Exception {
        ProgressDefinition definition = definition("daily_play_3", ProgressCategory.DAILY_QUEST, RequirementKind.PLAY_GAME, 3);
        UserProgress quest = quest(definition, ProgressStatus.ACTIVE, 2);
        when(userProgressRepository.findByProgressIdForUpdate(quest.getProgressId())).thenReturn(Optional.of(quest));

        ProgressionException thrown = assertThrows(
                ProgressionException.class,
                () -> progressTrackerService.claimReward(USER_ID, quest.getProgressId())
        );

        assertEquals("quest_not_completed", thrown.getCode());
        assertEquals(HttpStatus.BAD_REQUEST, thrown.getStatus());
    }

    @Test
    void claimRewardRejectsSecondClaim() throws Exception {
        ProgressDefinition definition = definition("daily_play_3", ProgressCategory.DAILY_QUEST, RequirementKind.PLAY_GAME, 3);
        UserProgress quest = quest(definition, ProgressStatus.CLAIMED, 3);
        when(userProgressRepository.findByProgressIdForUpdate(quest.getProgressId())).thenReturn(Optional.of(quest));

        ProgressionException thrown = assertThrows(
                ProgressionException.class,
                () -> progressTrackerService.claimReward(USER_ID, quest.getProgressId())
        );

        assertEquals(HttpStatus.CONFLICT, thrown.getStatus());
        assertEquals("already_claimed", thrown.getCode());
        verify(rewardLedger, never()).applyRewards(anyString(), anyList(), any(), anyString(), any());
    }

    @Test
    void claimRewardRejectsOtherPlayersQuest() throws Exception {
        ProgressDefinition definition = definition("daily_play_3", ProgressCategory.DAILY_QUEST, RequirementKind.PLAY_GAME, 3);
        UserProgress quest = quest(definition, ProgressStatus.COMPLETED, 3);
        when(userProgressRepository.findByProgressIdForUpdate(quest.getProgressId())).thenReturn(Optional.of(quest));

        ProgressionException thrown = assertThrows(
                ProgressionException.class,
                () -> progressTrackerService.claimReward("player-2", quest.getProgressId())
        );

        assertEquals(HttpStatus.FORBIDDEN, thrown.getStatus());
    }

    @Test
    void claimRewardForUnknownQuestIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(userProgressRepository.findByProgressIdForUpdate(missing)).thenReturn(Optional.empty());

        ProgressionException thrown = assertThrows(
                ProgressionException.class,
                () -> progressTrackerService.claimReward(USER_ID, missing)
        );

        assertEquals(HttpStatus.NOT_FOUND, thrown.getStatus());
        verify(battlePassService, never()).addXpToActiveSeason(anyString(), anyLong());
    }

    @Test
    void secretAchievementsAreMaskedUntilUnlocked() throws Exception {
        ProgressDefinition secret = definition("secret_comeback", ProgressCategory.ACHIEVEMENT, RequirementKind.WIN_GAME, 1);
        secret.setSecret(true);
        ProgressDefinition visible = definition("win_100", ProgressCategory.ACHIEVEMENT, RequirementKind.WIN_GAME, 100);
        ProgressDefinition unlockedSecret = definition("secret_streak", ProgressCategory.ACHIEVEMENT, RequirementKind.WIN_GAME, 1);
        unlockedSecret.setSecret(true);
        UserProgress unlockedRow = quest(unlockedSecret, ProgressStatus.UNLOCKED, 1);
        unlockedRow.setCategory(ProgressCategory.ACHIEVEMENT);

        when(userProgressRepository.findByUserIdAndCategory(USER_ID, ProgressCategory.ACHIEVEMENT))
                .thenReturn(List.of(unlockedRow));
        when(progressDefinitionRepository.findByCategoryAndActiveTrueOrderByDefinitionIdAsc(ProgressCategory.ACHIEVEMENT))
                .thenReturn(List.of(secret, unlockedSecret, visible));

        List<ProgressTrackerService.ProgressView> views = progressTrackerService.listAchievements(USER_ID);

        assertEquals(3, views.size());
        ProgressTrackerService.ProgressView first = views.get(0);
        assertEquals("secret_streak", first.definitionId());
        assertTrue(first.unlocked());
        assertEquals(unlockedSecret.getName(), first.name());

        ProgressTrackerService.ProgressView masked = views.stream()
                .filter(view -> view.definitionId().equals("secret_comeback"))
                .findFirst()
                .orElseThrow();
        assertEquals("???", masked.name());
        assertEquals("Secret achievement", masked.description());
        assertNull(masked.rewards());
        assertFalse(masked.unlocked());
        assertEquals(ProgressStatus.LOCKED, masked.status());
    }

    private ProgressDefinition definition(String id, ProgressCategory category, RequirementKind kind, int target) throws Exception {
        ProgressDefinition definition = new ProgressDefinition();
        definition.setDefinitionId(id);
        definition.setCategory(category);
        definition.setName("Name of " + id);
        definition.setDescription("Description of " + id);
        definition.setRequirementKind(kind);
        definition.setTargetValue(target);
        definition.setRewardsJson(objectMapper.readTree("{\"type\":\"GOLD\",\"amount\":25}"));
        return definition;
    }

    private UserProgress quest(ProgressDefinition definition, ProgressStatus status, int progress) {
        UserProgress row = new UserProgress();
        row.setProgressId(UUID.randomUUID());
        row.setUserId(USER_ID);
        row.setDefinitionId(definition.getDefinitionId());
        row.setCategory(definition.getCategory());
        row.setPeriodKey("2026-03-02");
        row.setTargetValue(definition.getTargetValue());
        row.setCurrentProgress(progress);
        row.setStatus(status);
        row.setStartedAt(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusHours(12));
        row.setExpiresAt(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(12));
        return row;
    }
}
