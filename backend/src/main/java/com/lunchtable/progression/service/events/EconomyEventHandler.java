package com.lunchtable.progression.service.events;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lunchtable.progression.config.ProgressionProperties;
import com.lunchtable.progression.model.CurrencyType;
import com.lunchtable.progression.model.HandlerGroup;
import com.lunchtable.progression.model.Reward;
import com.lunchtable.progression.model.RewardSource;
import com.lunchtable.progression.service.RewardLedger;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Game gold and wager settlement. Ledger reference ids are keyed by game, so a game pays out once
 * even if it is reported under two event ids.
 */
@Component
@RequiredArgsConstructor
public class EconomyEventHandler implements DomainEventHandler {

    private static final Logger log = LoggerFactory.getLogger(EconomyEventHandler.class);
    private static final long BASIS_POINTS = 10_000L;

    private final RewardLedger rewardLedger;
    private final ProgressionProperties progressionProperties;

    @Override
    public HandlerGroup group() {
        return HandlerGroup.ECONOMY;
    }

    @Override
    public void handle(DomainEvent event) {
        if (event instanceof DomainEvent.GameEnded gameEnded) {
            handleGameEnded(gameEnded);
        }
    }

    private void handleGameEnded(DomainEvent.GameEnded event) {
        ProgressionProperties.Economy economy = progressionProperties.getEconomy();
        if (event.winnerId() != null) {
            rewardLedger.applyReward(event.winnerId(), new Reward.Gold(economy.getWinGold()), RewardSource.GAMEPLAY,
                    "game:" + event.gameId() + ":win", gameMetadata(event));
        }
        if (event.loserId() != null) {
            rewardLedger.applyReward(event.loserId(), new Reward.Gold(economy.getLossGold()), RewardSource.GAMEPLAY,
                    "game:" + event.gameId() + ":loss", gameMetadata(event));
        }
        if (event.hasWager() && event.winnerId() != null) {
            settleWager(event, economy);
        }
    }

    private void settleWager(DomainEvent.GameEnded event, ProgressionProperties.Economy economy) {
        long pot = Math.multiplyExact(event.wagerAmount(), 2L);
        long fee = pot * economy.getWagerFeeBasisPoints() / BASIS_POINTS;
        long payout = pot - fee;
        CurrencyType currency = event.wagerCurrency() == null ? CurrencyType.GOLD : event.wagerCurrency();
        Reward reward;
        if (currency == CurrencyType.GOLD) {
            reward = new Reward.Gold(payout);
        } else if (currency == CurrencyType.GEMS) {
            reward = new Reward.Gems(payout);
        } else {
            throw new IllegalArgumentException("Wagers cannot be settled in " + currency);
        }

        ObjectNode metadata = gameMetadata(event);
        metadata.put("pot", pot);
        metadata.put("fee", fee);
        rewardLedger.applyReward(event.winnerId(), reward, RewardSource.GAMEPLAY, "wager:" + event.gameId(), metadata);
        log.info("Settled wager for game {}: winner {} receives {} {} (fee {})",
                event.gameId(), event.winnerId(), payout, currency, fee);
    }

    private static ObjectNode gameMetadata(DomainEvent.GameEnded event) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("gameId", event.gameId());
        if (event.mode() != null) {
            metadata.put("mode", event.mode().name());
        }
        return metadata;
    }
}
