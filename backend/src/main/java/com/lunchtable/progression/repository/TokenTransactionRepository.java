package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.TokenTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface TokenTransactionRepository extends JpaRepository<TokenTransaction, UUID> {
    boolean existsByReferenceId(UUID referenceId);
}
