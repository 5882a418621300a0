package com.lunchtable.progression.service.events;

import com.lunchtable.progression.config.ProgressionProperties;
import com.lunchtable.progression.model.CurrencyType;
import com.lunchtable.progression.model.GameMode;
import com.lunchtable.progression.model.Reward;
import com.lunchtable.progression.model.RewardSource;
import com.lunchtable.progression.service.RewardLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EconomyEventHandlerTest {

    @Mock
    private RewardLedger rewardLedger;

    private final ProgressionProperties progressionProperties = new ProgressionProperties();

    @Test
    void paysWinAndLossGoldKeyedByGame() {
        EconomyEventHandler handler = new EconomyEventHandler(rewardLedger, progressionProperties);

        handler.handle(gameEnded(null, null));

        verify(rewardLedger).applyReward(eq("winner"), eq(new Reward.Gold(25)), eq(RewardSource.GAMEPLAY), eq("game:g-7:win"), any());
        verify(rewardLedger).applyReward(eq("loser"), eq(new Reward.Gold(10)), eq(RewardSource.GAMEPLAY), eq("game:g-7:loss"), any());
        verify(rewardLedger, never()).applyReward(anyString(), any(), any(), eq("wager:g-7"), any());
    }

    @Test
    void wagerPotGoesToWinnerMinusPlatformFee() {
        EconomyEventHandler handler = new EconomyEventHandler(rewardLedger, progressionProperties);

        handler.handle(gameEnded(500L, CurrencyType.GEMS));

        verify(rewardLedger).applyReward(eq("winner"), eq(new Reward.Gems(950)), eq(RewardSource.GAMEPLAY), eq("wager:g-7"), any());
    }

    @Test
    void wagerFeeRoundsDownToWholeUnits() {
        progressionProperties.getEconomy().setWagerFeeBasisPoints(250);
        EconomyEventHandler handler = new EconomyEventHandler(rewardLedger, progressionProperties);

        handler.handle(gameEnded(101L, null));

        verify(rewardLedger).applyReward(eq("winner"), eq(new Reward.Gold(197)), eq(RewardSource.GAMEPLAY), eq("wager:g-7"), any());
    }

    @Test
    void wagersInNonSpendableCurrencyAreRejected() {
        EconomyEventHandler handler = new EconomyEventHandler(rewardLedger, progressionProperties);

        assertThrows(IllegalArgumentException.class, () -> handler.handle(gameEnded(100L, CurrencyType.XP)));
    }

    private static DomainEvent.GameEnded gameEnded(Long wager, CurrencyType currency) {
        return new DomainEvent.GameEnded(
                UUID.randomUUID(),
                OffsetDateTime.parse("2026-03-02T12:00:00Z"),
                "g-7",
                "winner",
                "loser",
                GameMode.CASUAL,
                null,
                null,
                wager,
                currency,
                9
        );
    }
}
