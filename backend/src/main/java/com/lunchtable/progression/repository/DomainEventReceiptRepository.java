package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.DomainEventReceipt;
import com.lunchtable.progression.model.HandlerGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface DomainEventReceiptRepository extends JpaRepository<DomainEventReceipt, UUID> {
    boolean existsByEventIdAndHandlerGroup(UUID eventId, HandlerGroup handlerGroup);
}
