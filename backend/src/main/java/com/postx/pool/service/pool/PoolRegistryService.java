package com.postx.pool.service.pool;

import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.RotationStrategy;
import com.postx.pool.exception.PoolNotConfiguredException;
import com.postx.pool.exception.ResourceNotFoundException;
import com.postx.pool.repository.AccountPoolRepository;
import com.postx.pool.repository.PoolMembershipRepository;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read path for pools and their members. Every call reads fresh state; nothing is cached. */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolRegistryService {

    private final AccountPoolRepository accountPoolRepository;
    private final PoolMembershipRepository poolMembershipRepository;

    /**
     * Active pool for the brand and platform, with memberships and accounts loaded. When several
     * active pools exist for the pair, the oldest one serves dispatches.
     */
    @Transactional(readOnly = true)
    public AccountPool getPool(Long brandId, Platform platform) {
        List<AccountPool> pools = accountPoolRepository.findActivePools(brandId, platform);
        if (pools.isEmpty()) {
            throw new PoolNotConfiguredException(brandId, platform);
        }
        if (pools.size() > 1) {
            log.debug(
                    "Brand {} has {} active {} pools, using pool {}",
                    brandId,
                    pools.size(),
                    platform,
                    pools.get(0).getId());
        }
        return loadPool(pools.get(0).getId());
    }

    @Transactional(readOnly = true)
    public AccountPool loadPool(Long poolId) {
        return accountPoolRepository
                .findByIdWithMemberships(poolId)
                .orElseThrow(() -> new ResourceNotFoundException("AccountPool", poolId));
    }

    /**
     * Members that may still be rotated: banned and suspended members and deactivated accounts are
     * dropped. PRIORITY pools come back by ascending priority, all others by membership id.
     */
    @Transactional(readOnly = true)
    public List<PoolMembership> listCandidates(Long poolId) {
        AccountPool pool =
                accountPoolRepository
                        .findById(poolId)
                        .orElseThrow(() -> new ResourceNotFoundException("AccountPool", poolId));
        Comparator<PoolMembership> order =
                pool.getRotationStrategy() == RotationStrategy.PRIORITY
                        ? Comparator.comparingInt(PoolMembership::getPriority)
                                .thenComparing(PoolMembership::getId)
                        : Comparator.comparing(PoolMembership::getId);
        return poolMembershipRepository.findByPoolIdWithAccount(poolId).stream()
                .filter(m -> !m.getStatus().isTerminal())
                .filter(m -> m.getSocialAccount().isActive())
                .sorted(order)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PoolMembership> getMemberships(Long poolId) {
        if (!accountPoolRepository.existsById(poolId)) {
            throw new ResourceNotFoundException("AccountPool", poolId);
        }
        return poolMembershipRepository.findByPoolIdWithAccount(poolId);
    }
}
