package com.lunchtable.progression.repository;

import com.lunchtable.progression.model.TokenBalanceCache;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TokenBalanceCacheRepository extends JpaRepository<TokenBalanceCache, String> {
}
