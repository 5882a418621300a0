package com.lunchtable.progression.service.events;

import com.lunchtable.progression.config.ProgressionProperties;
import com.lunchtable.progression.model.GameMode;
import com.lunchtable.progression.model.HandlerGroup;
import com.lunchtable.progression.model.RequirementKind;
import com.lunchtable.progression.service.BattlePassService;
import com.lunchtable.progression.service.ProgressEvent;
import com.lunchtable.progression.service.ProgressTrackerService;
import com.lunchtable.progression.service.QuestGenerationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Quests, achievements and gameplay battle pass XP.
 */
@Component
@RequiredArgsConstructor
public class ProgressionEventHandler implements DomainEventHandler {

    private final ProgressTrackerService progressTrackerService;
    private final QuestGenerationService questGenerationService;
    private final BattlePassService battlePassService;
    private final ProgressionProperties progressionProperties;

    @Override
    public HandlerGroup group() {
        return HandlerGroup.PROGRESSION;
    }

    @Override
    public void handle(DomainEvent event) {
        if (event instanceof DomainEvent.GameEnded gameEnded) {
            handleGameEnded(gameEnded);
        } else if (event instanceof DomainEvent.StoryStageCompleted stageCompleted) {
            handleStageCompleted(stageCompleted);
        }
    }

    private void handleGameEnded(DomainEvent.GameEnded event) {
        ProgressionProperties.BattlePass battlePass = progressionProperties.getBattlePass();
        if (event.winnerId() != null) {
            String winner = event.winnerId();
            questGenerationService.ensureUserHasQuests(winner);
            progressTrackerService.matchEvent(winner, ProgressEvent.of(RequirementKind.PLAY_GAME, event.mode(), event.winnerArchetype()));
            progressTrackerService.matchEvent(winner, ProgressEvent.of(RequirementKind.WIN_GAME, event.mode(), event.winnerArchetype()));
            if (event.mode() == GameMode.RANKED) {
                progressTrackerService.matchEvent(winner, ProgressEvent.of(RequirementKind.WIN_RANKED, event.mode(), event.winnerArchetype()));
            }
            battlePassService.grantGameplayXp(winner, battlePass.getWinXp());
        }
        if (event.loserId() != null) {
            String loser = event.loserId();
            questGenerationService.ensureUserHasQuests(loser);
            progressTrackerService.matchEvent(loser, ProgressEvent.of(RequirementKind.PLAY_GAME, event.mode(), event.loserArchetype()));
            battlePassService.grantGameplayXp(loser, battlePass.getLossXp());
        }
    }

    private void handleStageCompleted(DomainEvent.StoryStageCompleted event) {
        questGenerationService.ensureUserHasQuests(event.userId());
        progressTrackerService.matchEvent(event.userId(), ProgressEvent.of(RequirementKind.COMPLETE_STAGE, GameMode.STORY, null));
    }
}
