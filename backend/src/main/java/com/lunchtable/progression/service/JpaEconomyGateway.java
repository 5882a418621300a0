package com.lunchtable.progression.service;

import com.lunchtable.progression.model.CurrencyTransaction;
import com.lunchtable.progression.model.CurrencyType;
import com.lunchtable.progression.model.InventoryItemType;
import com.lunchtable.progression.model.PlayerWallet;
import com.lunchtable.progression.repository.CurrencyTransactionRepository;
import com.lunchtable.progression.repository.PlayerInventoryItemRepository;
import com.lunchtable.progression.repository.PlayerWalletRepository;
import com.lunchtable.progression.web.ProgressionException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class JpaEconomyGateway implements EconomyGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaEconomyGateway.class);

    private final PlayerWalletRepository playerWalletRepository;
    private final CurrencyTransactionRepository currencyTransactionRepository;
    private final PlayerInventoryItemRepository playerInventoryItemRepository;
    private final Clock clock;

    @Override
    @Transactional
    public WalletBalances adjustCurrency(
            String userId,
            Map<CurrencyType, Long> deltas,
            String transactionType,
            String referenceId
    ) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        playerWalletRepository.insertIfAbsent(userId, now);
        PlayerWallet wallet = playerWalletRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("Wallet row missing after insert for user " + userId));

        Map<CurrencyType, Long> orderedDeltas = new EnumMap<>(CurrencyType.class);
        orderedDeltas.putAll(deltas);

        List<CurrencyTransaction> transactions = new ArrayList<>();
        for (Map.Entry<CurrencyType, Long> delta : orderedDeltas.entrySet()) {
            long amount = delta.getValue() == null ? 0L : delta.getValue();
            if (amount == 0L) {
                continue;
            }
            CurrencyType currency = delta.getKey();
            long balanceAfter = wallet.balanceOf(currency) + amount;
            if (balanceAfter < 0) {
                throw ProgressionException.validation(
                        "insufficient_" + currency.name().toLowerCase(Locale.ROOT),
                        "Insufficient " + currency.name().toLowerCase(Locale.ROOT)
                                + ": need " + Math.abs(amount) + ", have " + wallet.balanceOf(currency)
                );
            }
            wallet.setBalance(currency, balanceAfter);
            transactions.add(buildTransaction(userId, currency, amount, balanceAfter, transactionType, referenceId, now));
        }

        if (transactions.isEmpty()) {
            return snapshot(wallet);
        }
        wallet.setUpdatedAt(now);
        playerWalletRepository.save(wallet);
        currencyTransactionRepository.saveAll(transactions);
        log.debug("Applied {} currency deltas for user {} ({} {})", transactions.size(), userId, transactionType, referenceId);
        return snapshot(wallet);
    }

    @Override
    @Transactional
    public void grantItem(String userId, InventoryItemType itemType, String itemRef, int quantity, String referenceId) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Item quantity must be positive");
        }
        playerInventoryItemRepository.upsertQuantity(
                UUID.randomUUID(),
                userId,
                itemType.name(),
                itemRef,
                quantity,
                OffsetDateTime.now(clock)
        );
        log.debug("Granted {}x {} {} to user {} ({})", quantity, itemType, itemRef, userId, referenceId);
    }

    private CurrencyTransaction buildTransaction(
            String userId,
            CurrencyType currency,
            long delta,
            long balanceAfter,
            String transactionType,
            String referenceId,
            OffsetDateTime now
    ) {
        CurrencyTransaction transaction = new CurrencyTransaction();
        transaction.setTransactionId(UUID.randomUUID());
        transaction.setUserId(userId);
        transaction.setCurrency(currency);
        transaction.setDelta(delta);
        transaction.setBalanceAfter(balanceAfter);
        transaction.setTransactionType(transactionType);
        transaction.setReferenceId(referenceId);
        transaction.setCreatedAt(now);
        return transaction;
    }

    private static WalletBalances snapshot(PlayerWallet wallet) {
        return new WalletBalances(wallet.getGold(), wallet.getGems(), wallet.getTotalXp());
    }
}
