package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.PlayerInventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.UUID;

@Repository
public interface PlayerInventoryItemRepository extends JpaRepository<PlayerInventoryItem, UUID> {

    @Modifying
    @Query(
            value = """
                    INSERT INTO player_inventory (item_id, user_id, item_type, item_ref, quantity, acquired_at, updated_at)
                    VALUES (:itemId, :userId, :itemType, :itemRef, :quantity, :now, :now)
                    ON CONFLICT (user_id, item_type, item_ref)
                    DO UPDATE SET quantity = player_inventory.quantity + EXCLUDED.quantity,
                                  updated_at = EXCLUDED.updated_at
                    """,
            nativeQuery = true
    )
    int upsertQuantity(
            @Param("itemId") UUID itemId,
            @Param("userId") String userId,
            @Param("itemType") String itemType,
            @Param("itemRef") String itemRef,
            @Param("quantity") int quantity,
            @Param("now") OffsetDateTime now
    );
}
