package com.lunchtable.progression.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lunchtable.progression.config.ProgressionProperties;
import com.lunchtable.progression.model.BattlePassSeason;
import com.lunchtable.progression.model.NotificationKind;
import com.lunchtable.progression.model.PendingPurchase;
import com.lunchtable.progression.model.PremiumSource;
import com.lunchtable.progression.model.PurchaseFailureReason;
import com.lunchtable.progression.model.PurchaseStatus;
import com.lunchtable.progression.model.TokenTransaction;
import com.lunchtable.progression.repository.PendingPurchaseRepository;
import com.lunchtable.progression.repository.TokenTransactionRepository;
import com.lunchtable.progression.service.scheduling.DeferredTask;
import com.lunchtable.progression.service.scheduling.DeferredTaskScheduler;
import com.lunchtable.progression.web.ProgressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Token-paid premium pass purchase.
 * <p>
 * {@code AWAITING_SIGNATURE -> SUBMITTED -> CONFIRMED | FAILED | EXPIRED}. Every step re-reads the
 * persisted row and schedules the next one as a deferred task, so a restarted node resumes polling
 * where the last one stopped. The confirmation deadline is measured from {@code createdAt} and is
 * checked before the chain is consulted.
 */
@Service
public class PurchaseConfirmationWorkflow {

    private static final Logger log = LoggerFactory.getLogger(PurchaseConfirmationWorkflow.class);
    private static final List<PurchaseStatus> OPEN_STATUSES =
            List.of(PurchaseStatus.AWAITING_SIGNATURE, PurchaseStatus.SUBMITTED);
    private static final int MAX_SIGNATURE_LENGTH = 128;
    private static final int MAX_FAILURE_DETAIL_LENGTH = 1_000;

    private final PendingPurchaseRepository pendingPurchaseRepository;
    private final TokenTransactionRepository tokenTransactionRepository;
    private final BattlePassService battlePassService;
    private final TransferPayloadBuilder transferPayloadBuilder;
    private final ChainSignatureClient chainSignatureClient;
    private final DeferredTaskScheduler deferredTaskScheduler;
    private final NotificationService notificationService;
    private final ProgressionProperties progressionProperties;
    private final TransactionTemplate transactionTemplate;
    private final String treasuryWallet;
    private final String tokenMint;
    private final Clock clock;

    public PurchaseConfirmationWorkflow(
            PendingPurchaseRepository pendingPurchaseRepository,
            TokenTransactionRepository tokenTransactionRepository,
            BattlePassService battlePassService,
            TransferPayloadBuilder transferPayloadBuilder,
            ChainSignatureClient chainSignatureClient,
            DeferredTaskScheduler deferredTaskScheduler,
            NotificationService notificationService,
            ProgressionProperties progressionProperties,
            TransactionTemplate transactionTemplate,
            @Qualifier("solanaTreasuryWallet") String treasuryWallet,
            @Qualifier("solanaTokenMint") String tokenMint,
            Clock clock
    ) {
        this.pendingPurchaseRepository = pendingPurchaseRepository;
        this.tokenTransactionRepository = tokenTransactionRepository;
        this.battlePassService = battlePassService;
        this.transferPayloadBuilder = transferPayloadBuilder;
        this.chainSignatureClient = chainSignatureClient;
        this.deferredTaskScheduler = deferredTaskScheduler;
        this.notificationService = notificationService;
        this.progressionProperties = progressionProperties;
        this.transactionTemplate = transactionTemplate;
        this.treasuryWallet = treasuryWallet;
        this.tokenMint = tokenMint;
        this.clock = clock;
    }

    @Transactional(noRollbackFor = ProgressionException.class)
    public PurchaseIntent initiate(String userId, String buyerWallet) {
        if (!SolanaService.isValidPublicKey(buyerWallet)) {
            throw ProgressionException.validation("invalid_wallet", "Buyer wallet is not a valid Solana address");
        }
        BattlePassSeason season = battlePassService.requireActiveSeason();
        Long tokenPrice = season.getPremiumTokenPrice();
        if (tokenPrice == null || tokenPrice <= 0) {
            throw ProgressionException.validation(
                    "token_purchase_unavailable",
                    "Season " + season.getSeasonNumber() + " has no token price"
            );
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        enforceRateLimit(userId, now);

        // Lock order: open purchase row, then pass progress. completeLocked takes them in the same order.
        Optional<PendingPurchase> open =
                pendingPurchaseRepository.findOpenForBuyerAndSeasonForUpdate(userId, season.getSeasonId(), OPEN_STATUSES);
        if (open.isPresent()) {
            PendingPurchase existing = open.get();
            if (existing.getStatus() == PurchaseStatus.AWAITING_SIGNATURE && now.isAfter(existing.getExpiresAt())) {
                markExpired(existing, PurchaseFailureReason.SIGNATURE_EXPIRED, now);
                pendingPurchaseRepository.saveAndFlush(existing);
                log.info("Expired stale purchase intent {} for user {}", existing.getPurchaseId(), userId);
            } else {
                throw ProgressionException.conflict(
                        "purchase_in_progress",
                        "Purchase " + existing.getPurchaseId() + " is still " + existing.getStatus()
                );
            }
        }

        if (battlePassService.lockOrCreateProgress(userId, season.getSeasonId()).isPremium()) {
            throw ProgressionException.conflict("already_premium", "Premium pass already active for this season");
        }

        UUID purchaseId = UUID.randomUUID();
        String transaction;
        try {
            transaction = transferPayloadBuilder.build(purchaseId, buyerWallet.trim(), treasuryWallet, tokenMint, tokenPrice);
        } catch (ChainRpcException ex) {
            log.warn("Could not build transfer for user {}: {}", userId, ex.getMessage());
            throw ProgressionException.unavailable("chain_unavailable", "Solana RPC is unavailable, try again shortly");
        }

        PendingPurchase purchase = new PendingPurchase();
        purchase.setPurchaseId(purchaseId);
        purchase.setBuyerId(userId);
        purchase.setSeasonId(season.getSeasonId());
        purchase.setAmount(tokenPrice);
        purchase.setBuyerWallet(buyerWallet.trim());
        purchase.setTreasuryWallet(treasuryWallet);
        purchase.setTokenMint(tokenMint);
        purchase.setStatus(PurchaseStatus.AWAITING_SIGNATURE);
        purchase.setCreatedAt(now);
        purchase.setExpiresAt(now.plusSeconds(progressionProperties.getPurchase().getIntentTtlSeconds()));
        purchase.setUpdatedAt(now);
        try {
            pendingPurchaseRepository.saveAndFlush(purchase);
        } catch (DataIntegrityViolationException ex) {
            throw ProgressionException.conflict("purchase_in_progress", "Another purchase for this season is in progress");
        }

        log.info("User {} initiated token purchase {} for season {}", userId, purchaseId, season.getSeasonNumber());
        return new PurchaseIntent(purchaseId, transaction, tokenPrice, treasuryWallet, tokenMint, purchase.getExpiresAt());
    }

    private void enforceRateLimit(String userId, OffsetDateTime now) {
        ProgressionProperties.Purchase purchase = progressionProperties.getPurchase();
        int limit = purchase.getRateLimitMaxInitiations();
        if (limit <= 0) {
            return;
        }
        List<PendingPurchase> recent = pendingPurchaseRepository.findByBuyerIdAndCreatedAtAfterOrderByCreatedAtAsc(
                userId,
                now.minusSeconds(purchase.getRateLimitWindowSeconds())
        );
        if (recent.size() >= limit) {
            OffsetDateTime resetAt = recent.get(recent.size() - limit)
                    .getCreatedAt()
                    .plusSeconds(purchase.getRateLimitWindowSeconds());
            throw ProgressionException.rateLimited("Too many purchase attempts", resetAt);
        }
    }

    /**
     * Records the buyer's transaction signature and starts confirmation polling. An intent past its
     * expiry is moved to EXPIRED and the call is rejected; the expiry is kept.
     */
    @Transactional(noRollbackFor = ProgressionException.class)
    public PurchaseView submit(String userId, UUID purchaseId, String signature) {
        if (signature == null || signature.isBlank() || signature.trim().length() > MAX_SIGNATURE_LENGTH) {
            throw ProgressionException.validation("invalid_signature", "A transaction signature is required");
        }
        String trimmedSignature = signature.trim();
        PendingPurchase purchase = lockOwned(userId, purchaseId);

        if (purchase.getStatus() == PurchaseStatus.SUBMITTED && trimmedSignature.equals(purchase.getSignature())) {
            return PurchaseView.from(purchase);
        }
        if (purchase.getStatus() != PurchaseStatus.AWAITING_SIGNATURE) {
            throw ProgressionException.conflict(
                    "invalid_purchase_state",
                    "Purchase is " + purchase.getStatus() + ", expected AWAITING_SIGNATURE"
            );
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (now.isAfter(purchase.getExpiresAt())) {
            markExpired(purchase, PurchaseFailureReason.SIGNATURE_EXPIRED, now);
            pendingPurchaseRepository.save(purchase);
            log.info("Purchase {} expired before submission", purchaseId);
            throw ProgressionException.validation("purchase_expired", "Purchase intent expired at " + purchase.getExpiresAt());
        }
        if (pendingPurchaseRepository.existsBySignature(trimmedSignature)) {
            throw ProgressionException.conflict("signature_in_use", "Signature already submitted for another purchase");
        }

        purchase.setSignature(trimmedSignature);
        purchase.setStatus(PurchaseStatus.SUBMITTED);
        purchase.setSubmittedAt(now);
        purchase.setUpdatedAt(now);
        pendingPurchaseRepository.save(purchase);

        deferredTaskScheduler.schedule(
                new DeferredTask.PollPurchaseConfirmation(purchaseId, 1, 0),
                Duration.ofMillis(progressionProperties.getPurchase().getPollDelayMs())
        );
        log.info("Purchase {} submitted with signature {}", purchaseId, trimmedSignature);
        return PurchaseView.from(purchase);
    }

    /**
     * One confirmation check. Runs outside a transaction: the chain is queried without holding any
     * row lock, and the resulting transition re-validates the row under lock.
     */
    public PollOutcome poll(DeferredTask.PollPurchaseConfirmation task) {
        Optional<PendingPurchase> snapshot = pendingPurchaseRepository.findById(task.purchaseId());
        if (snapshot.isEmpty()) {
            log.warn("Poll for unknown purchase {} ignored", task.purchaseId());
            return PollOutcome.IGNORED;
        }
        PendingPurchase purchase = snapshot.get();
        if (purchase.getStatus() != PurchaseStatus.SUBMITTED) {
            log.debug("Poll for purchase {} ignored in state {}", purchase.getPurchaseId(), purchase.getStatus());
            return PollOutcome.IGNORED;
        }

        ProgressionProperties.Purchase settings = progressionProperties.getPurchase();
        OffsetDateTime now = OffsetDateTime.now(clock);
        transactionTemplate.executeWithoutResult(status -> pendingPurchaseRepository.markPolled(purchase.getPurchaseId(), now));
        OffsetDateTime deadline = purchase.getCreatedAt().plusSeconds(settings.getConfirmationTimeoutSeconds());
        if (now.isAfter(deadline)) {
            return failed(fail(
                    purchase.getPurchaseId(),
                    PurchaseFailureReason.TIMEOUT,
                    "Not confirmed within " + settings.getConfirmationTimeoutSeconds() + "s of creation"
            ));
        }

        if (purchase.getSignature() == null) {
            return notFound(task, settings, "Purchase has no signature");
        }

        SignatureStatus status;
        try {
            status = chainSignatureClient.getSignatureStatus(purchase.getSignature());
        } catch (ChainRpcException ex) {
            int rpcErrors = task.rpcErrors() + 1;
            if (rpcErrors >= settings.getMaxRpcErrorAttempts()) {
                return failed(fail(purchase.getPurchaseId(), PurchaseFailureReason.RPC_ERROR, ex.getMessage()));
            }
            log.warn(
                    "RPC error {} of {} polling purchase {}: {}",
                    rpcErrors,
                    settings.getMaxRpcErrorAttempts(),
                    purchase.getPurchaseId(),
                    ex.getMessage()
            );
            reschedule(new DeferredTask.PollPurchaseConfirmation(task.purchaseId(), task.attempt(), rpcErrors),
                    settings.getRpcErrorDelayMs());
            return PollOutcome.RESCHEDULED;
        }

        if (!status.found()) {
            return notFound(task, settings, "Signature not found on chain after " + task.attempt() + " polls");
        }
        if (status.failed()) {
            return failed(fail(purchase.getPurchaseId(), PurchaseFailureReason.CHAIN_ERROR, status.error()));
        }
        if (reachedRequiredLevel(status, settings)) {
            return complete(purchase.getPurchaseId()) == PurchaseStatus.CONFIRMED
                    ? PollOutcome.CONFIRMED
                    : PollOutcome.IGNORED;
        }
        // Seen but below the required level: the not-found budget is untouched, the deadline still applies.
        reschedule(new DeferredTask.PollPurchaseConfirmation(task.purchaseId(), task.attempt(), task.rpcErrors()),
                settings.getPollDelayMs());
        return PollOutcome.RESCHEDULED;
    }

    /**
     * Restarts confirmation polling for submitted purchases whose poll chain went quiet, for example
     * a queue message lost between commit and enqueue. Purchases already past the confirmation
     * deadline are failed instead.
     *
     * @return number of purchases re-enqueued or failed
     */
    public int recoverStalledPolls() {
        ProgressionProperties.Purchase settings = progressionProperties.getPurchase();
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<UUID> stalled = pendingPurchaseRepository.findStalled(
                PurchaseStatus.SUBMITTED,
                now.minusSeconds(settings.getStalledPollSeconds()),
                PageRequest.of(0, settings.getStalledPollBatchSize())
        );
        int recovered = 0;
        for (UUID purchaseId : stalled) {
            Boolean handled = transactionTemplate.execute(status -> recoverLocked(purchaseId, settings, now));
            if (Boolean.TRUE.equals(handled)) {
                recovered++;
            }
        }
        return recovered;
    }

    private boolean recoverLocked(UUID purchaseId, ProgressionProperties.Purchase settings, OffsetDateTime now) {
        PendingPurchase purchase = pendingPurchaseRepository.findByPurchaseIdForUpdate(purchaseId).orElse(null);
        if (purchase == null || purchase.getStatus() != PurchaseStatus.SUBMITTED) {
            return false;
        }
        if (now.isAfter(purchase.getCreatedAt().plusSeconds(settings.getConfirmationTimeoutSeconds()))) {
            return failLocked(
                    purchaseId,
                    PurchaseFailureReason.TIMEOUT,
                    "Not confirmed within " + settings.getConfirmationTimeoutSeconds() + "s of creation"
            );
        }
        purchase.setLastPolledAt(now);
        pendingPurchaseRepository.save(purchase);
        deferredTaskScheduler.scheduleNow(new DeferredTask.PollPurchaseConfirmation(purchaseId, 1, 0));
        log.warn("Re-enqueued confirmation polling for stalled purchase {}", purchaseId);
        return true;
    }

    private PollOutcome notFound(
            DeferredTask.PollPurchaseConfirmation task,
            ProgressionProperties.Purchase settings,
            String detail
    ) {
        if (task.attempt() >= settings.getMaxNotFoundAttempts()) {
            return failed(fail(task.purchaseId(), PurchaseFailureReason.NO_SIGNATURE, detail));
        }
        reschedule(new DeferredTask.PollPurchaseConfirmation(task.purchaseId(), task.attempt() + 1, task.rpcErrors()),
                settings.getPollDelayMs());
        return PollOutcome.RESCHEDULED;
    }

    private static PollOutcome failed(boolean transitioned) {
        return transitioned ? PollOutcome.FAILED : PollOutcome.IGNORED;
    }

    private boolean reachedRequiredLevel(SignatureStatus status, ProgressionProperties.Purchase settings) {
        ConfirmationLevel required = ConfirmationLevel.parse(settings.getRequiredConfirmation());
        try {
            return ConfirmationLevel.parse(status.confirmationStatus()).meets(required);
        } catch (IllegalArgumentException ex) {
            log.warn("Unrecognised confirmation status '{}', treating as unconfirmed", status.confirmationStatus());
            return false;
        }
    }

    private void reschedule(DeferredTask.PollPurchaseConfirmation next, long delayMs) {
        deferredTaskScheduler.schedule(next, Duration.ofMillis(delayMs));
    }

    /**
     * Grants the premium pass for a submitted purchase. Repeated calls are no-ops.
     *
     * @return the purchase status after the call
     */
    public PurchaseStatus complete(UUID purchaseId) {
        return transactionTemplate.execute(status -> completeLocked(purchaseId));
    }

    private PurchaseStatus completeLocked(UUID purchaseId) {
        PendingPurchase purchase = pendingPurchaseRepository.findByPurchaseIdForUpdate(purchaseId).orElse(null);
        if (purchase == null) {
            log.warn("Complete for unknown purchase {} ignored", purchaseId);
            return null;
        }
        if (purchase.getStatus() != PurchaseStatus.SUBMITTED) {
            log.info("Complete for purchase {} ignored in state {}", purchaseId, purchase.getStatus());
            return purchase.getStatus();
        }

        boolean granted = battlePassService.grantPremium(purchase.getBuyerId(), purchase.getSeasonId(), PremiumSource.TOKEN);
        if (!granted) {
            log.warn("User {} already held premium for season {}; confirming purchase {} without a second grant",
                    purchase.getBuyerId(), purchase.getSeasonId(), purchaseId);
        }

        if (!tokenTransactionRepository.existsByReferenceId(purchaseId)) {
            TokenTransaction transaction = new TokenTransaction();
            transaction.setTransactionId(UUID.randomUUID());
            transaction.setUserId(purchase.getBuyerId());
            transaction.setTransactionType(TokenTransaction.TYPE_PREMIUM_PASS_PURCHASE);
            transaction.setAmount(-purchase.getAmount());
            transaction.setSignature(purchase.getSignature());
            transaction.setReferenceId(purchaseId);
            transaction.setDescription("Premium battle pass, season " + purchase.getSeasonId());
            transaction.setCreatedAt(OffsetDateTime.now(clock));
            tokenTransactionRepository.save(transaction);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        purchase.setStatus(PurchaseStatus.CONFIRMED);
        purchase.setResolvedAt(now);
        purchase.setUpdatedAt(now);
        pendingPurchaseRepository.save(purchase);

        deferredTaskScheduler.scheduleNow(
                new DeferredTask.RefreshTokenBalance(purchase.getBuyerId(), purchase.getBuyerWallet())
        );
        notificationService.notifyPlayer(
                purchase.getBuyerId(),
                NotificationKind.PURCHASE_CONFIRMED,
                purchase.getPurchaseId().toString(),
                "Premium pass unlocked",
                "Your token payment was confirmed.",
                purchaseData(purchase)
        );
        log.info("Purchase {} confirmed for user {}", purchaseId, purchase.getBuyerId());
        return PurchaseStatus.CONFIRMED;
    }

    /**
     * Moves a non-terminal purchase to FAILED.
     *
     * @return true when this call made the transition, false when the purchase was already terminal
     */
    public boolean fail(UUID purchaseId, PurchaseFailureReason reason, String detail) {
        Boolean failed = transactionTemplate.execute(status -> failLocked(purchaseId, reason, detail));
        return Boolean.TRUE.equals(failed);
    }

    private boolean failLocked(UUID purchaseId, PurchaseFailureReason reason, String detail) {
        PendingPurchase purchase = pendingPurchaseRepository.findByPurchaseIdForUpdate(purchaseId).orElse(null);
        if (purchase == null || purchase.getStatus().isTerminal()) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        purchase.setStatus(PurchaseStatus.FAILED);
        purchase.setFailureReason(reason);
        purchase.setFailureDetail(truncate(detail));
        purchase.setResolvedAt(now);
        purchase.setUpdatedAt(now);
        pendingPurchaseRepository.save(purchase);

        notificationService.notifyPlayer(
                purchase.getBuyerId(),
                NotificationKind.PURCHASE_FAILED,
                purchase.getPurchaseId().toString(),
                "Premium pass purchase failed",
                "Your token payment could not be confirmed (" + reason + ").",
                purchaseData(purchase)
        );
        log.warn("Purchase {} failed: {} {}", purchaseId, reason, detail);
        return true;
    }

    @Transactional
    public PurchaseView cancel(String userId, UUID purchaseId) {
        PendingPurchase purchase = lockOwned(userId, purchaseId);
        if (purchase.getStatus() != PurchaseStatus.AWAITING_SIGNATURE) {
            throw ProgressionException.conflict(
                    "invalid_purchase_state",
                    "Only purchases awaiting a signature can be cancelled"
            );
        }
        markExpired(purchase, PurchaseFailureReason.CANCELLED, OffsetDateTime.now(clock));
        pendingPurchaseRepository.save(purchase);
        log.info("User {} cancelled purchase {}", userId, purchaseId);
        return PurchaseView.from(purchase);
    }

    @Transactional(readOnly = true)
    public PurchaseView getPurchase(String userId, UUID purchaseId) {
        PendingPurchase purchase = pendingPurchaseRepository.findById(purchaseId)
                .orElseThrow(() -> ProgressionException.notFound("purchase_not_found", "Purchase not found: " + purchaseId));
        if (!purchase.getBuyerId().equals(userId)) {
            throw ProgressionException.forbidden("Purchase belongs to another player");
        }
        return PurchaseView.from(purchase);
    }

    @Transactional(readOnly = true)
    public List<PurchaseView> listRecentPurchases(String userId) {
        return pendingPurchaseRepository.findTop10ByBuyerIdOrderByCreatedAtDesc(userId)
                .stream()
                .map(PurchaseView::from)
                .toList();
    }

    private PendingPurchase lockOwned(String userId, UUID purchaseId) {
        PendingPurchase purchase = pendingPurchaseRepository.findByPurchaseIdForUpdate(purchaseId)
                .orElseThrow(() -> ProgressionException.notFound("purchase_not_found", "Purchase not found: " + purchaseId));
        if (!purchase.getBuyerId().equals(userId)) {
            throw ProgressionException.forbidden("Purchase belongs to another player");
        }
        return purchase;
    }

    private static void markExpired(PendingPurchase purchase, PurchaseFailureReason reason, OffsetDateTime now) {
        purchase.setStatus(PurchaseStatus.EXPIRED);
        purchase.setFailureReason(reason);
        purchase.setResolvedAt(now);
        purchase.setUpdatedAt(now);
    }

    private static ObjectNode purchaseData(PendingPurchase purchase) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("purchaseId", purchase.getPurchaseId().toString());
        data.put("seasonId", purchase.getSeasonId().toString());
        data.put("status", purchase.getStatus().name());
        return data;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_FAILURE_DETAIL_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_FAILURE_DETAIL_LENGTH);
    }

    public enum PollOutcome {
        IGNORED,
        RESCHEDULED,
        CONFIRMED,
        FAILED
    }

    public record PurchaseIntent(
            UUID purchaseId,
            String transaction,
            long amount,
            String treasuryWallet,
            String tokenMint,
            OffsetDateTime expiresAt
    ) {
    }

    public record PurchaseView(
            UUID purchaseId,
            UUID seasonId,
            long amount,
            String buyerWallet,
            String treasuryWallet,
            PurchaseStatus status,
            String signature,
            PurchaseFailureReason failureReason,
            String failureDetail,
            OffsetDateTime createdAt,
            OffsetDateTime expiresAt,
            OffsetDateTime submittedAt,
            OffsetDateTime resolvedAt
    ) {
        static PurchaseView from(PendingPurchase purchase) {
            return new PurchaseView(
                    purchase.getPurchaseId(),
                    purchase.getSeasonId(),
                    purchase.getAmount(),
                    purchase.getBuyerWallet(),
                    purchase.getTreasuryWallet(),
                    purchase.getStatus(),
                    purchase.getSignature(),
                    purchase.getFailureReason(),
                    purchase.getFailureDetail(),
                    purchase.getCreatedAt(),
                    purchase.getExpiresAt(),
                    purchase.getSubmittedAt(),
                    purchase.getResolvedAt()
            );
        }
    }
}
