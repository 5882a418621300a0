package com.lunchtable.progression.service;

import com.lunchtable.progression.model.CurrencyType;
import com.lunchtable.progression.model.InventoryItemType;

import java.util.Map;

/**
 * Player currency and inventory. Implementations join the caller's transaction.
 */
public interface EconomyGateway {

    /**
     * Applies signed deltas atomically. A delta that would take a balance below zero rejects the whole call
     * with a validation error coded {@code insufficient_<currency>}.
     */
    WalletBalances adjustCurrency(
            String userId,
            Map<CurrencyType, Long> deltas,
            String transactionType,
            String referenceId
    );

    void grantItem(String userId, InventoryItemType itemType, String itemRef, int quantity, String referenceId);

    record WalletBalances(long gold, long gems, long xp) {
    }
}
