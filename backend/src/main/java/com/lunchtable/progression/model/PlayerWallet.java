package com.lunchtable.progression.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "player_wallets")
public class PlayerWallet {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "gold", nullable = false)
    private long gold;

    @Column(name = "gems", nullable = false)
    private long gems;

    @Column(name = "total_xp", nullable = false)
    private long totalXp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public long balanceOf(CurrencyType currency) {
        return switch (currency) {
            case GOLD -> gold;
            case GEMS -> gems;
            case XP -> totalXp;
        };
    }

    public void setBalance(CurrencyType currency, long balance) {
        switch (currency) {
            case GOLD -> gold = balance;
            case GEMS -> gems = balance;
            case XP -> totalXp = balance;
        }
    }
}
