package com.lunchtable.progression.service.events;

import com.lunchtable.progression.model.CurrencyType;
import com.lunchtable.progression.model.GameMode;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Immutable fact about a gameplay outcome. The event id deduplicates redelivery per handler group.
 */
public sealed interface DomainEvent {

    String KIND_GAME_ENDED = "game_ended";
    String KIND_STORY_STAGE_COMPLETED = "story_stage_completed";

    UUID eventId();

    OffsetDateTime occurredAt();

    String kind();

    /**
     * @param loserId     null for games against the AI
     * @param wagerAmount stake each side put up, or null when the game carried no wager
     */
    record GameEnded(
            UUID eventId,
            OffsetDateTime occurredAt,
            String gameId,
            String winnerId,
            String loserId,
            GameMode mode,
            String winnerArchetype,
            String loserArchetype,
            Long wagerAmount,
            CurrencyType wagerCurrency,
            Integer turns
    ) implements DomainEvent {
        @Override
        public String kind() {
            return KIND_GAME_ENDED;
        }

        public boolean hasWager() {
            return wagerAmount != null && wagerAmount > 0 && loserId != null;
        }
    }

    record StoryStageCompleted(
            UUID eventId,
            OffsetDateTime occurredAt,
            String userId,
            String chapterId,
            String stageId,
            int stars,
            boolean firstClear
    ) implements DomainEvent {
        @Override
        public String kind() {
            return KIND_STORY_STAGE_COMPLETED;
        }
    }
}
