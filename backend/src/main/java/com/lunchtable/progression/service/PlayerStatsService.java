package com.lunchtable.progression.service;

import com.lunchtable.progression.model.PlayerStats;
import com.lunchtable.progression.repository.PlayerStatsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

@Service
@RequiredArgsConstructor
public class PlayerStatsService {

    private final PlayerStatsRepository playerStatsRepository;
    private final Clock clock;

    @Transactional
    public PlayerStats recordGameResult(String userId, boolean won, boolean ranked) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PlayerStats stats = lockOrCreate(userId, now);
        stats.setGamesPlayed(stats.getGamesPlayed() + 1);
        if (won) {
            stats.setWins(stats.getWins() + 1);
            stats.setCurrentWinStreak(stats.getCurrentWinStreak() + 1);
            stats.setBestWinStreak(Math.max(stats.getBestWinStreak(), stats.getCurrentWinStreak()));
            if (ranked) {
                stats.setRankedWins(stats.getRankedWins() + 1);
            }
        } else {
            stats.setLosses(stats.getLosses() + 1);
            stats.setCurrentWinStreak(0);
        }
        touch(stats, now);
        return playerStatsRepository.save(stats);
    }

    @Transactional
    public PlayerStats recordStageCompleted(String userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PlayerStats stats = lockOrCreate(userId, now);
        stats.setStoryStagesCompleted(stats.getStoryStagesCompleted() + 1);
        touch(stats, now);
        return playerStatsRepository.save(stats);
    }

    private PlayerStats lockOrCreate(String userId, OffsetDateTime now) {
        playerStatsRepository.insertIfAbsent(userId, now);
        return playerStatsRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("Player stats missing after insert for user " + userId));
    }

    private static void touch(PlayerStats stats, OffsetDateTime now) {
        stats.setLastActiveAt(now);
        stats.setUpdatedAt(now);
    }
}
