package com.lunchtable.progression.controller;

import com.lunchtable.progression.dto.ProgressionRequests;
import com.lunchtable.progression.model.BattlePassProgress;
import com.lunchtable.progression.service.BattlePassService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/battle-pass")
public class BattlePassController {

    private final BattlePassService battlePassService;

    public BattlePassController(BattlePassService battlePassService) {
        this.battlePassService = battlePassService;
    }

    @GetMapping
    public ResponseEntity<BattlePassService.BattlePassStatus> getStatus(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        return ResponseEntity.ok(battlePassService.getStatus(playerId));
    }

    @PostMapping("/claim")
    public ResponseEntity<BattlePassService.TierClaimResult> claimTier(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId,
            @Valid @RequestBody ProgressionRequests.ClaimTierRequest request
    ) {
        return ResponseEntity.ok(battlePassService.claimTierReward(playerId, request.tier(), request.track()));
    }

    @PostMapping("/claim-all")
    public ResponseEntity<BattlePassService.ClaimAllResult> claimAll(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        return ResponseEntity.ok(battlePassService.claimAll(playerId));
    }

    @PostMapping("/premium/gems")
    public ResponseEntity<BattlePassService.BattlePassStatus> purchasePremiumWithGems(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        BattlePassProgress progress = battlePassService.purchasePremiumWithGems(playerId);
        return ResponseEntity.ok(battlePassService.getStatus(progress.getUserId()));
    }
}
