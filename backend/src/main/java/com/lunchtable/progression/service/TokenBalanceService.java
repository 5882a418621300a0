package com.lunchtable.progression.service;

import com.lunchtable.progression.model.TokenBalanceCache;
import com.lunchtable.progression.repository.TokenBalanceCacheRepository;
import com.lunchtable.progression.service.scheduling.DeferredTask;
import com.lunchtable.progression.web.ProgressionException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Cached view of a player's on-chain token balance. Confirmed purchases queue a refresh that re-reads
 * the buyer's token account; a failed read leaves the entry stale and is retried.
 */
@Service
@RequiredArgsConstructor
public class TokenBalanceService {

    private static final Logger log = LoggerFactory.getLogger(TokenBalanceService.class);

    private final TokenBalanceCacheRepository tokenBalanceCacheRepository;
    private final SolanaService solanaService;
    private final Clock clock;

    @Transactional(noRollbackFor = TokenBalanceRefreshException.class)
    public TokenBalanceCache refresh(DeferredTask.RefreshTokenBalance task) {
        TokenBalanceCache cache = tokenBalanceCacheRepository.findById(task.userId()).orElseGet(() -> {
            TokenBalanceCache created = new TokenBalanceCache();
            created.setUserId(task.userId());
            return created;
        });
        cache.setWalletAddress(task.walletAddress());

        long balance;
        try {
            balance = solanaService.getTokenBalance(task.walletAddress());
        } catch (ChainRpcException e) {
            cache.setStale(true);
            cache.setUpdatedAt(OffsetDateTime.now(clock));
            tokenBalanceCacheRepository.save(cache);
            log.warn("Token balance refresh failed for user {} wallet {}: {}", task.userId(), task.walletAddress(), e.getMessage());
            throw new TokenBalanceRefreshException("Token balance refresh failed for user " + task.userId(), e);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        cache.setRawBalance(balance);
        cache.setStale(false);
        cache.setRefreshedAt(now);
        cache.setUpdatedAt(now);
        log.info("Refreshed token balance for user {}: {}", task.userId(), balance);
        return tokenBalanceCacheRepository.save(cache);
    }

    @Transactional(readOnly = true)
    public TokenBalanceView getBalance(String userId) {
        return tokenBalanceCacheRepository.findById(userId)
                .map(TokenBalanceView::from)
                .orElseThrow(() -> ProgressionException.notFound("balance_not_found", "No token balance recorded for " + userId));
    }

    public record TokenBalanceView(
            String walletAddress,
            Long rawBalance,
            boolean stale,
            OffsetDateTime refreshedAt
    ) {
        static TokenBalanceView from(TokenBalanceCache cache) {
            return new TokenBalanceView(cache.getWalletAddress(), cache.getRawBalance(), cache.isStale(), cache.getRefreshedAt());
        }
    }
}
