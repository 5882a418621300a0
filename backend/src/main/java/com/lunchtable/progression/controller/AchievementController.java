package com.lunchtable.progression.controller;

import com.lunchtable.progression.service.ProgressTrackerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/achievements")
public class AchievementController {

    private final ProgressTrackerService progressTrackerService;

    public AchievementController(ProgressTrackerService progressTrackerService) {
        this.progressTrackerService = progressTrackerService;
    }

    @GetMapping
    public ResponseEntity<List<ProgressTrackerService.ProgressView>> listAchievements(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        return ResponseEntity.ok(progressTrackerService.listAchievements(playerId));
    }
}
