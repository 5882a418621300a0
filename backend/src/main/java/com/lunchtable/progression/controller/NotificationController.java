package com.lunchtable.progression.controller;

import com.lunchtable.progression.dto.ProgressionResponses;
import com.lunchtable.progression.service.NotificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<List<ProgressionResponses.NotificationSummary>> listNotifications(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        return ResponseEntity.ok(notificationService.listRecent(playerId)
                .stream()
                .map(ProgressionResponses.NotificationSummary::from)
                .toList());
    }
}
