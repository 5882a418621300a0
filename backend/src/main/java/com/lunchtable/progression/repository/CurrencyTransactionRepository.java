package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.CurrencyTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CurrencyTransactionRepository extends JpaRepository<CurrencyTransaction, UUID> {
    List<CurrencyTransaction> findByUserIdOrderByCreatedAtDesc(String userId);
}
