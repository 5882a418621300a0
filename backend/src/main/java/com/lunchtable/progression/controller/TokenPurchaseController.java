package com.lunchtable.progression.controller;

import com.lunchtable.progression.dto.ProgressionRequests;
import com.lunchtable.progression.service.PurchaseConfirmationWorkflow;
import com.lunchtable.progression.service.TokenBalanceService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Token-paid premium pass. Confirmation is asynchronous; clients poll {@code GET /{purchaseId}}.
 */
@RestController
@RequestMapping("/api/battle-pass/premium/token")
public class TokenPurchaseController {

    private final PurchaseConfirmationWorkflow purchaseConfirmationWorkflow;
    private final TokenBalanceService tokenBalanceService;

    public TokenPurchaseController(
            PurchaseConfirmationWorkflow purchaseConfirmationWorkflow,
            TokenBalanceService tokenBalanceService
    ) {
        this.purchaseConfirmationWorkflow = purchaseConfirmationWorkflow;
        this.tokenBalanceService = tokenBalanceService;
    }

    @PostMapping
    public ResponseEntity<PurchaseConfirmationWorkflow.PurchaseIntent> initiate(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId,
            @Valid @RequestBody ProgressionRequests.InitiateTokenPurchaseRequest request
    ) {
        PurchaseConfirmationWorkflow.PurchaseIntent intent =
                purchaseConfirmationWorkflow.initiate(playerId, request.buyerWallet());
        return ResponseEntity.status(HttpStatus.CREATED).body(intent);
    }

    @PostMapping("/{purchaseId}/submit")
    public ResponseEntity<PurchaseConfirmationWorkflow.PurchaseView> submit(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId,
            @PathVariable UUID purchaseId,
            @Valid @RequestBody ProgressionRequests.SubmitSignatureRequest request
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(purchaseConfirmationWorkflow.submit(playerId, purchaseId, request.signature()));
    }

    @PostMapping("/{purchaseId}/cancel")
    public ResponseEntity<PurchaseConfirmationWorkflow.PurchaseView> cancel(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId,
            @PathVariable UUID purchaseId
    ) {
        return ResponseEntity.ok(purchaseConfirmationWorkflow.cancel(playerId, purchaseId));
    }

    @GetMapping("/balance")
    public ResponseEntity<TokenBalanceService.TokenBalanceView> getBalance(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        return ResponseEntity.ok(tokenBalanceService.getBalance(playerId));
    }

    @GetMapping("/{purchaseId}")
    public ResponseEntity<PurchaseConfirmationWorkflow.PurchaseView> getPurchase(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId,
            @PathVariable UUID purchaseId
    ) {
        return ResponseEntity.ok(purchaseConfirmationWorkflow.getPurchase(playerId, purchaseId));
    }

    @GetMapping
    public ResponseEntity<List<PurchaseConfirmationWorkflow.PurchaseView>> listRecent(
            @RequestHeader(PlayerHeaders.PLAYER_ID) String playerId
    ) {
        return ResponseEntity.ok(purchaseConfirmationWorkflow.listRecentPurchases(playerId));
    }
}
