package com.lunchtable.progression.controller;

import com.lunchtable.progression.service.ProgressTrackerService;
import com.lunchtable.progression.service.QuestGenerationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/quests")
public class QuestController {

    private final ProgressTrackerService progressTrackerService;
    private final QuestGenerationService questGenerationService;

    public QuestController(ProgressTrackerService progressTrackerService, QuestGenerationService questGenerationService) {
        this.progressTrackerService = progressTrackerService;
        this.questGenerationService = questGenerationService;
    }

    @GetMapping
    public ResponseEntity<List<ProgressTrackerService.ProgressView>> listQuests(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        return ResponseEntity.ok(progressTrackerService.listQuests(playerId));
    }

    @PostMapping("/ensure")
    public ResponseEntity<QuestGenerationService.EnsureResult> ensureQuests(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        return ResponseEntity.ok(questGenerationService.ensureUserHasQuests(playerId));
    }

    @PostMapping("/{questId}/claim")
    public ResponseEntity<ProgressTrackerService.QuestClaimResult> claimQuest(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId,
            @PathVariable UUID questId
    ) {
        return ResponseEntity.ok(progressTrackerService.claimReward(playerId, questId));
    }
}
