package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.BattlePassTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BattlePassTierRepository extends JpaRepository<BattlePassTier, UUID> {
    Optional<BattlePassTier> findBySeasonIdAndTierNumber(UUID seasonId, int tierNumber);

    List<BattlePassTier> findBySeasonIdOrderByTierNumberAsc(UUID seasonId);

    List<BattlePassTier> findBySeasonIdAndTierNumberLessThanEqualOrderByTierNumberAsc(UUID seasonId, int tierNumber);
}
