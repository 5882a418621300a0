package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.PlayerWallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface PlayerWalletRepository extends JpaRepository<PlayerWallet, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select w from PlayerWallet w where w.userId = :userId")
    Optional<PlayerWallet> findByUserIdForUpdate(@Param("userId") String userId);

    @Modifying
    @Query(
            value = """
                    INSERT INTO player_wallets (user_id, created_at, updated_at)
                    VALUES (:userId, :now, :now)
                    ON CONFLICT (user_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(@Param("userId") String userId, @Param("now") OffsetDateTime now);
}
