package com.lunchtable.progression.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lunchtable.progression.config.ProgressionProperties;
import com.lunchtable.progression.model.BattlePassProgress;
import com.lunchtable.progression.model.BattlePassSeason;
import com.lunchtable.progression.model.BattlePassTier;
import com.lunchtable.progression.model.CurrencyType;
import com.lunchtable.progression.model.NotificationKind;
import com.lunchtable.progression.model.PremiumSource;
import com.lunchtable.progression.model.Reward;
import com.lunchtable.progression.model.RewardJsonCodec;
import com.lunchtable.progression.model.RewardSource;
import com.lunchtable.progression.model.RewardTrack;
import com.lunchtable.progression.model.SeasonStatus;
import com.lunchtable.progression.repository.BattlePassProgressRepository;
import com.lunchtable.progression.repository.BattlePassSeasonRepository;
import com.lunchtable.progression.repository.BattlePassTierRepository;
import com.lunchtable.progression.web.ProgressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class BattlePassService {

    private static final Logger log = LoggerFactory.getLogger(BattlePassService.class);

    private final BattlePassSeasonRepository battlePassSeasonRepository;
    private final BattlePassTierRepository battlePassTierRepository;
    private final BattlePassProgressRepository battlePassProgressRepository;
    private final RewardLedger rewardLedger;
    private final EconomyGateway economyGateway;
    private final NotificationService notificationService;
    private final ProgressionProperties progressionProperties;
    private final Clock clock;

    public BattlePassService(
            BattlePassSeasonRepository battlePassSeasonRepository,
            BattlePassTierRepository battlePassTierRepository,
            BattlePassProgressRepository battlePassProgressRepository,
            RewardLedger rewardLedger,
            EconomyGateway economyGateway,
            NotificationService notificationService,
            ProgressionProperties progressionProperties,
            Clock clock
    ) {
        this.battlePassSeasonRepository = battlePassSeasonRepository;
        this.battlePassTierRepository = battlePassTierRepository;
        this.battlePassProgressRepository = battlePassProgressRepository;
        this.rewardLedger = rewardLedger;
        this.economyGateway = economyGateway;
        this.notificationService = notificationService;
        this.progressionProperties = progressionProperties;
        this.clock = clock;
    }

    public BattlePassSeason requireActiveSeason() {
        return findActiveSeason()
                .orElseThrow(() -> ProgressionException.notFound("no_active_season", "No active battle pass season"));
    }

    public Optional<BattlePassSeason> findActiveSeason() {
        return battlePassSeasonRepository.findFirstByStatusOrderByStartsAtDesc(SeasonStatus.ACTIVE);
    }

    /**
     * Locks the user's progress row for the season, creating it first when absent.
     */
    @Transactional
    public BattlePassProgress lockOrCreateProgress(String userId, UUID seasonId) {
        battlePassProgressRepository.insertIfAbsent(UUID.randomUUID(), userId, seasonId, OffsetDateTime.now(clock));
        return battlePassProgressRepository.findByUserIdAndSeasonIdForUpdate(userId, seasonId)
                .orElseThrow(() -> new IllegalStateException(
                        "Battle pass progress missing after insert for user " + userId + " season " + seasonId
                ));
    }

    @Transactional
    public XpResult addXp(String userId, UUID seasonId, long delta) {
        BattlePassSeason season = battlePassSeasonRepository.findById(seasonId)
                .orElseThrow(() -> ProgressionException.notFound("season_not_found", "Season not found: " + seasonId));
        if (delta <= 0) {
            Optional<BattlePassProgress> existing = battlePassProgressRepository.findByUserIdAndSeasonId(userId, seasonId);
            long xp = existing.map(BattlePassProgress::getCurrentXp).orElse(0L);
            int tier = existing.map(BattlePassProgress::getCurrentTier).orElse(0);
            return new XpResult(seasonId, tier, tier, 0, xp);
        }
        BattlePassProgress progress = lockOrCreateProgress(userId, seasonId);
        return applyXp(season, progress, delta);
    }

    /**
     * Adds XP to the active season, if there is one. Used for XP earned from quests and achievements.
     */
    @Transactional
    public Optional<XpResult> addXpToActiveSeason(String userId, long delta) {
        if (delta <= 0) {
            return Optional.empty();
        }
        return findActiveSeason().map(season -> applyXp(season, lockOrCreateProgress(userId, season.getSeasonId()), delta));
    }

    /**
     * Adds gameplay XP to the active season, scaled by the premium multiplier for premium holders.
     */
    @Transactional
    public Optional<XpResult> grantGameplayXp(String userId, long baseXp) {
        if (baseXp <= 0) {
            return Optional.empty();
        }
        return findActiveSeason().map(season -> {
            BattlePassProgress progress = lockOrCreateProgress(userId, season.getSeasonId());
            long xp = progress.isPremium() ? applyPremiumMultiplier(baseXp) : baseXp;
            return applyXp(season, progress, xp);
        });
    }

    long applyPremiumMultiplier(long baseXp) {
        BigDecimal multiplier = progressionProperties.getBattlePass().getPremiumXpMultiplier();
        if (multiplier == null || multiplier.compareTo(BigDecimal.ONE) <= 0) {
            return baseXp;
        }
        return BigDecimal.valueOf(baseXp).multiply(multiplier).setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    private XpResult applyXp(BattlePassSeason season, BattlePassProgress progress, long delta) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int oldTier = progress.getCurrentTier();
        long newXp = progress.getCurrentXp() + delta;
        int newTier = BattlePassTiers.tierFor(newXp, season.getXpPerTier(), season.getTotalTiers());

        progress.setCurrentXp(newXp);
        progress.setCurrentTier(newTier);
        progress.setLastXpGainAt(now);
        progress.setUpdatedAt(now);
        battlePassProgressRepository.save(progress);

        int tiersGained = Math.max(0, newTier - oldTier);
        if (tiersGained > 0) {
            ObjectNode data = JsonNodeFactory.instance.objectNode();
            data.put("seasonId", season.getSeasonId().toString());
            data.put("oldTier", oldTier);
            data.put("newTier", newTier);
            data.put("tiersGained", tiersGained);
            notificationService.notifyPlayer(
                    progress.getUserId(),
                    NotificationKind.TIER_UP,
                    season.getSeasonId() + ":" + newTier,
                    "Tier " + newTier + " reached",
                    tiersGained == 1
                            ? "You reached battle pass tier " + newTier + "."
                            : "You climbed " + tiersGained + " battle pass tiers to tier " + newTier + ".",
                    data
            );
            log.info("User {} advanced from tier {} to {} in season {}", progress.getUserId(), oldTier, newTier,
                    season.getSeasonNumber());
        }
        return new XpResult(season.getSeasonId(), oldTier, newTier, tiersGained, newXp);
    }

    @Transactional
    public TierClaimResult claimTierReward(String userId, int tierNumber, RewardTrack track) {
        BattlePassSeason season = requireActiveSeason();
        BattlePassProgress progress = lockOrCreateProgress(userId, season.getSeasonId());
        if (tierNumber < 1 || tierNumber > progress.getCurrentTier()) {
            throw ProgressionException.validation(
                    "tier_locked",
                    "Tier " + tierNumber + " is not unlocked (current tier " + progress.getCurrentTier() + ")"
            );
        }
        if (track == RewardTrack.PREMIUM && !progress.isPremium()) {
            throw ProgressionException.forbidden("Premium pass required to claim premium rewards");
        }
        BattlePassTier tier = battlePassTierRepository.findBySeasonIdAndTierNumber(season.getSeasonId(), tierNumber)
                .orElseThrow(() -> ProgressionException.notFound("tier_not_found", "Tier " + tierNumber + " not found"));
        return claimUnlockedTier(season, progress, tier, track);
    }

    private TierClaimResult claimUnlockedTier(
            BattlePassSeason season,
            BattlePassProgress progress,
            BattlePassTier tier,
            RewardTrack track
    ) {
        JsonNode rewardJson = tier.rewardFor(track);
        if (rewardJson == null) {
            throw ProgressionException.notFound(
                    "reward_not_found",
                    "No " + track.name().toLowerCase(Locale.ROOT) + " reward at tier " + tier.getTierNumber()
            );
        }
        if (progress.hasClaimed(tier.getTierNumber(), track)) {
            throw ProgressionException.conflict(
                    "already_claimed",
                    "Tier " + tier.getTierNumber() + " " + track.name().toLowerCase(Locale.ROOT) + " reward already claimed"
            );
        }

        List<Reward> rewards = RewardJsonCodec.fromJson(rewardJson);
        String referenceId = "battle_pass:" + season.getSeasonId() + ":" + tier.getTierNumber() + ":" + track.name();
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("seasonNumber", season.getSeasonNumber());
        metadata.put("tier", tier.getTierNumber());
        metadata.put("track", track.name());
        RewardLedger.RewardGrant grant = rewardLedger.applyRewards(
                progress.getUserId(),
                rewards,
                RewardSource.BATTLE_PASS,
                referenceId,
                metadata
        );

        progress.markClaimed(tier.getTierNumber(), track);
        progress.setUpdatedAt(OffsetDateTime.now(clock));
        battlePassProgressRepository.save(progress);
        return new TierClaimResult(tier.getTierNumber(), track, rewards, grant);
    }

    @Transactional
    public ClaimAllResult claimAll(String userId) {
        BattlePassSeason season = requireActiveSeason();
        BattlePassProgress progress = lockOrCreateProgress(userId, season.getSeasonId());
        List<BattlePassTier> unlockedTiers = battlePassTierRepository
                .findBySeasonIdAndTierNumberLessThanEqualOrderByTierNumberAsc(season.getSeasonId(), progress.getCurrentTier());

        List<TierClaimResult> claims = new ArrayList<>();
        for (BattlePassTier tier : unlockedTiers) {
            if (isClaimable(progress, tier, RewardTrack.FREE)) {
                claims.add(claimUnlockedTier(season, progress, tier, RewardTrack.FREE));
            }
            if (isClaimable(progress, tier, RewardTrack.PREMIUM)) {
                claims.add(claimUnlockedTier(season, progress, tier, RewardTrack.PREMIUM));
            }
        }

        int freeClaimed = (int) claims.stream().filter(claim -> claim.track() == RewardTrack.FREE).count();
        int premiumClaimed = claims.size() - freeClaimed;
        log.info("User {} claimed {} free and {} premium tiers", userId, freeClaimed, premiumClaimed);
        return new ClaimAllResult(freeClaimed, premiumClaimed, claims);
    }

    private static boolean isClaimable(BattlePassProgress progress, BattlePassTier tier, RewardTrack track) {
        if (tier.getTierNumber() > progress.getCurrentTier()) {
            return false;
        }
        if (track == RewardTrack.PREMIUM && !progress.isPremium()) {
            return false;
        }
        return tier.rewardFor(track) != null && !progress.hasClaimed(tier.getTierNumber(), track);
    }

    @Transactional
    public BattlePassProgress purchasePremiumWithGems(String userId) {
        BattlePassSeason season = requireActiveSeason();
        Long gemPrice = season.getPremiumGemPrice();
        if (gemPrice == null || gemPrice <= 0) {
            throw ProgressionException.validation(
                    "gem_purchase_unavailable",
                    "Season " + season.getSeasonNumber() + " cannot be unlocked with gems"
            );
        }
        BattlePassProgress progress = lockOrCreateProgress(userId, season.getSeasonId());
        if (progress.isPremium()) {
            throw ProgressionException.conflict("already_premium", "Premium pass already active for this season");
        }

        economyGateway.adjustCurrency(
                userId,
                Map.of(CurrencyType.GEMS, -gemPrice),
                "BATTLE_PASS_PREMIUM",
                "battle_pass_premium:" + season.getSeasonId()
        );

        activatePremium(progress, PremiumSource.GEMS);
        log.info("User {} unlocked premium pass for season {} with {} gems", userId, season.getSeasonNumber(), gemPrice);
        return progress;
    }

    /**
     * Flips the season progress to premium unless it already is.
     *
     * @return false when the user already held the premium pass
     */
    @Transactional
    public boolean grantPremium(String userId, UUID seasonId, PremiumSource source) {
        BattlePassProgress progress = lockOrCreateProgress(userId, seasonId);
        if (progress.isPremium()) {
            return false;
        }
        activatePremium(progress, source);
        return true;
    }

    private void activatePremium(BattlePassProgress progress, PremiumSource source) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        progress.setPremium(true);
        progress.setPremiumSource(source);
        progress.setPremiumPurchasedAt(now);
        progress.setUpdatedAt(now);
        battlePassProgressRepository.save(progress);
    }

    @Transactional(readOnly = true)
    public BattlePassStatus getStatus(String userId) {
        BattlePassSeason season = requireActiveSeason();
        Optional<BattlePassProgress> progress =
                battlePassProgressRepository.findByUserIdAndSeasonId(userId, season.getSeasonId());
        long xp = progress.map(BattlePassProgress::getCurrentXp).orElse(0L);
        int currentTier = progress.map(BattlePassProgress::getCurrentTier).orElse(0);
        boolean premium = progress.map(BattlePassProgress::isPremium).orElse(false);

        List<TierView> tiers = battlePassTierRepository.findBySeasonIdOrderByTierNumberAsc(season.getSeasonId())
                .stream()
                .map(tier -> {
                    boolean freeClaimed = progress.map(p -> p.hasClaimed(tier.getTierNumber(), RewardTrack.FREE)).orElse(false);
                    boolean premiumClaimed = progress.map(p -> p.hasClaimed(tier.getTierNumber(), RewardTrack.PREMIUM)).orElse(false);
                    boolean unlocked = tier.getTierNumber() <= currentTier;
                    return new TierView(
                            tier.getTierNumber(),
                            tier.isMilestone(),
                            tier.rewardFor(RewardTrack.FREE),
                            tier.rewardFor(RewardTrack.PREMIUM),
                            freeClaimed,
                            premiumClaimed,
                            unlocked && tier.rewardFor(RewardTrack.FREE) != null && !freeClaimed,
                            unlocked && premium && tier.rewardFor(RewardTrack.PREMIUM) != null && !premiumClaimed
                    );
                })
                .toList();

        OffsetDateTime now = OffsetDateTime.now(clock);
        long daysRemaining = Math.max(0, Duration.between(now, season.getEndsAt()).toDays());
        return new BattlePassStatus(
                season.getSeasonId(),
                season.getSeasonNumber(),
                season.getName(),
                xp,
                currentTier,
                season.getTotalTiers(),
                season.getXpPerTier(),
                BattlePassTiers.xpToNextTier(xp, season.getXpPerTier(), season.getTotalTiers()),
                BattlePassTiers.tierProgress(xp, season.getXpPerTier(), season.getTotalTiers()),
                premium,
                season.getPremiumGemPrice(),
                season.getPremiumTokenPrice(),
                daysRemaining,
                tiers
        );
    }

    public record XpResult(UUID seasonId, int oldTier, int newTier, int tiersGained, long newXp) {
    }

    public record TierClaimResult(int tier, RewardTrack track, List<Reward> rewards, RewardLedger.RewardGrant grant) {
    }

    public record ClaimAllResult(int freeClaimed, int premiumClaimed, List<TierClaimResult> claims) {
    }

    public record TierView(
            int tier,
            boolean milestone,
            JsonNode freeReward,
            JsonNode premiumReward,
            boolean freeClaimed,
            boolean premiumClaimed,
            boolean freeClaimable,
            boolean premiumClaimable
    ) {
    }

    public record BattlePassStatus(
            UUID seasonId,
            int seasonNumber,
            String seasonName,
            long currentXp,
            int currentTier,
            int totalTiers,
            int xpPerTier,
            long xpToNextTier,
            double tierProgress,
            boolean premium,
            Long premiumGemPrice,
            Long premiumTokenPrice,
            long daysRemaining,
            List<TierView> tiers
    ) {
    }
}
