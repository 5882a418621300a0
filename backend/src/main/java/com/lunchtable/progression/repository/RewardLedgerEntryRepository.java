package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.RewardLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RewardLedgerEntryRepository extends JpaRepository<RewardLedgerEntry, UUID> {
    boolean existsByUserIdAndReferenceIdAndEntryKey(String userId, String referenceId, String entryKey);

    List<RewardLedgerEntry> findByUserIdAndReferenceIdOrderByEntryKeyAsc(String userId, String referenceId);
}
