package com.lunchtable.progression.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lunchtable.progression.model.CurrencyType;
import com.lunchtable.progression.model.InventoryItemType;
import com.lunchtable.progression.model.Reward;
import com.lunchtable.progression.model.RewardLedgerEntry;
import com.lunchtable.progression.model.RewardSource;
import com.lunchtable.progression.repository.RewardLedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Applies reward payloads through the economy and writes one audit entry per component.
 * <p>
 * Callers guard "not yet claimed" on their own locked row in the same transaction. The
 * (user, reference, entry key) uniqueness here is a second line of defence: a component that is already
 * on the ledger is skipped, and a concurrent duplicate fails the transaction on the unique constraint.
 */
@Service
@RequiredArgsConstructor
public class RewardLedger {

    private static final Logger log = LoggerFactory.getLogger(RewardLedger.class);

    private final EconomyGateway economyGateway;
    private final RewardLedgerEntryRepository rewardLedgerEntryRepository;
    private final Clock clock;

    @Transactional
    public RewardGrant applyReward(
            String userId,
            Reward reward,
            RewardSource source,
            String referenceId,
            JsonNode metadata
    ) {
        return applyRewards(userId, List.of(reward), source, referenceId, metadata);
    }

    @Transactional
    public RewardGrant applyRewards(
            String userId,
            List<Reward> rewards,
            RewardSource source,
            String referenceId,
            JsonNode metadata
    ) {
        long gold = 0;
        long gems = 0;
        long xp = 0;
        List<Reward> items = new ArrayList<>();
        OffsetDateTime now = OffsetDateTime.now(clock);
        String transactionType = source.name() + "_REWARD";

        for (int index = 0; index < rewards.size(); index++) {
            Reward reward = rewards.get(index);
            String entryKey = index + ":" + reward.type().toLowerCase(Locale.ROOT);
            if (rewardLedgerEntryRepository.existsByUserIdAndReferenceIdAndEntryKey(userId, referenceId, entryKey)) {
                log.warn("Reward {} for user {} already on ledger as {}; skipping", referenceId, userId, entryKey);
                continue;
            }

            long amount;
            String itemRef = null;
            if (reward instanceof Reward.Gold goldReward) {
                amount = goldReward.amount();
                if (amount <= 0) {
                    continue;
                }
                economyGateway.adjustCurrency(userId, Map.of(CurrencyType.GOLD, amount), transactionType, referenceId);
                gold += amount;
            } else if (reward instanceof Reward.Gems gemsReward) {
                amount = gemsReward.amount();
                if (amount <= 0) {
                    continue;
                }
                economyGateway.adjustCurrency(userId, Map.of(CurrencyType.GEMS, amount), transactionType, referenceId);
                gems += amount;
            } else if (reward instanceof Reward.Xp xpReward) {
                amount = xpReward.amount();
                if (amount <= 0) {
                    continue;
                }
                economyGateway.adjustCurrency(userId, Map.of(CurrencyType.XP, amount), transactionType, referenceId);
                xp += amount;
            } else if (reward instanceof Reward.Card card) {
                amount = card.quantity();
                itemRef = card.cardDefinitionId();
                economyGateway.grantItem(userId, InventoryItemType.CARD, itemRef, card.quantity(), referenceId);
                items.add(card);
            } else if (reward instanceof Reward.Pack pack) {
                amount = pack.quantity();
                itemRef = pack.packType();
                economyGateway.grantItem(userId, InventoryItemType.PACK, itemRef, pack.quantity(), referenceId);
                items.add(pack);
            } else if (reward instanceof Reward.Title title) {
                amount = 1;
                itemRef = title.titleId();
                economyGateway.grantItem(userId, InventoryItemType.TITLE, itemRef, 1, referenceId);
                items.add(title);
            } else if (reward instanceof Reward.Avatar avatar) {
                amount = 1;
                itemRef = avatar.avatarId();
                economyGateway.grantItem(userId, InventoryItemType.AVATAR, itemRef, 1, referenceId);
                items.add(avatar);
            } else {
                throw new IllegalArgumentException("Unsupported reward: " + reward);
            }

            RewardLedgerEntry entry = new RewardLedgerEntry();
            entry.setEntryId(UUID.randomUUID());
            entry.setUserId(userId);
            entry.setSource(source);
            entry.setReferenceId(referenceId);
            entry.setEntryKey(entryKey);
            entry.setRewardType(reward.type());
            entry.setAmount(amount);
            entry.setItemRef(itemRef);
            entry.setMetadataJson(metadata);
            entry.setCreatedAt(now);
            rewardLedgerEntryRepository.save(entry);
        }

        RewardGrant grant = new RewardGrant(gold, gems, xp, List.copyOf(items));
        log.info(
                "Granted {} reward {} to user {}: gold={}, gems={}, xp={}, items={}",
                source,
                referenceId,
                userId,
                gold,
                gems,
                xp,
                items.size()
        );
        return grant;
    }

    public record RewardGrant(long gold, long gems, long xp, List<Reward> items) {
        public static RewardGrant empty() {
            return new RewardGrant(0, 0, 0, List.of());
        }

        public RewardGrant plus(RewardGrant other) {
            List<Reward> combined = new ArrayList<>(items);
            combined.addAll(other.items);
            return new RewardGrant(gold + other.gold, gems + other.gems, xp + other.xp, List.copyOf(combined));
        }
    }
}
