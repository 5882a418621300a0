package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.PendingPurchase;
import com.lunchtable.progression.model.PurchaseStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PendingPurchaseRepository extends JpaRepository<PendingPurchase, UUID> {
    List<PendingPurchase> findTop10ByBuyerIdOrderByCreatedAtDesc(String buyerId);

    boolean existsBySignature(String signature);

    List<PendingPurchase> findByBuyerIdAndCreatedAtAfterOrderByCreatedAtAsc(String buyerId, OffsetDateTime since);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PendingPurchase p where p.purchaseId = :purchaseId")
    Optional<PendingPurchase> findByPurchaseIdForUpdate(@Param("purchaseId") UUID purchaseId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select p from PendingPurchase p
            where p.buyerId = :buyerId
              and p.seasonId = :seasonId
              and p.status in :statuses
            """)
    Optional<PendingPurchase> findOpenForBuyerAndSeasonForUpdate(
            @Param("buyerId") String buyerId,
            @Param("seasonId") UUID seasonId,
            @Param("statuses") Collection<PurchaseStatus> statuses
    );

    @Modifying
    @Query("update PendingPurchase p set p.lastPolledAt = :now where p.purchaseId = :purchaseId")
    int markPolled(@Param("purchaseId") UUID purchaseId, @Param("now") OffsetDateTime now);

    /**
     * Purchases in {@code status} with no confirmation check since {@code cutoff}. A purchase that was never
     * polled counts from its submission.
     */
    @Query("""
            select p.purchaseId from PendingPurchase p
            where p.status = :status
              and coalesce(p.lastPolledAt, p.submittedAt) < :cutoff
            order by p.submittedAt asc
            """)
    List<UUID> findStalled(
            @Param("status") PurchaseStatus status,
            @Param("cutoff") OffsetDateTime cutoff,
            Pageable pageable
    );
}
