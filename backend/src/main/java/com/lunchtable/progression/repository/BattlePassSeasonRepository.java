package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.BattlePassSeason;
import com.lunchtable.progression.model.SeasonStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BattlePassSeasonRepository extends JpaRepository<BattlePassSeason, UUID> {
    Optional<BattlePassSeason> findFirstByStatusOrderByStartsAtDesc(SeasonStatus status);
}
