package com.lunchtable.progression.service.events;

import com.lunchtable.progression.model.GameMode;
import com.lunchtable.progression.model.HandlerGroup;
import com.lunchtable.progression.service.PlayerStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StatsEventHandler implements DomainEventHandler {

    private final PlayerStatsService playerStatsService;

    @Override
    public HandlerGroup group() {
        return HandlerGroup.STATS;
    }

    @Override
    public void handle(DomainEvent event) {
        if (event instanceof DomainEvent.GameEnded gameEnded) {
            boolean ranked = gameEnded.mode() == GameMode.RANKED;
            if (gameEnded.winnerId() != null) {
                playerStatsService.recordGameResult(gameEnded.winnerId(), true, ranked);
            }
            if (gameEnded.loserId() != null) {
                playerStatsService.recordGameResult(gameEnded.loserId(), false, ranked);
            }
        } else if (event instanceof DomainEvent.StoryStageCompleted stageCompleted) {
            playerStatsService.recordStageCompleted(stageCompleted.userId());
        }
    }
}
