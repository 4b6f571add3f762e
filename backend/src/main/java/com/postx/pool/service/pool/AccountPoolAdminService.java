package com.postx.pool.service.pool;

import com.postx.pool.dto.request.AddMemberRequest;
import com.postx.pool.dto.request.CreatePoolRequest;
import com.postx.pool.dto.request.UpdateMemberRequest;
import com.postx.pool.dto.request.UpdatePoolRequest;
import com.postx.pool.dto.response.AccountPoolResponse;
import com.postx.pool.dto.response.PoolMembershipResponse;
import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.exception.InvalidPoolConfigurationException;
import com.postx.pool.exception.ResourceNotFoundException;
import com.postx.pool.repository.AccountPoolRepository;
import com.postx.pool.repository.PoolMembershipRepository;
import com.postx.pool.repository.SocialAccountRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Pool configuration and membership administration. None of this runs on the dispatch path;
 * dispatches pick up changes on their next read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountPoolAdminService {

    private final AccountPoolRepository accountPoolRepository;
    private final PoolMembershipRepository poolMembershipRepository;
    private final SocialAccountRepository socialAccountRepository;
    private final RotationSelector rotationSelector;
    private final Clock clock;

    @Transactional
    public AccountPoolResponse createPool(CreatePoolRequest request) {
        if (accountPoolRepository.existsByBrandIdAndPlatformAndName(
                request.getBrandId(), request.getPlatform(), request.getName())) {
            throw new InvalidPoolConfigurationException(
                    String.format(
                            "Pool '%s' already exists for brand %d on %s",
                            request.getName(), request.getBrandId(), request.getPlatform()));
        }
        AccountPool pool =
                AccountPool.builder()
                        .brandId(request.getBrandId())
                        .platform(request.getPlatform())
                        .name(request.getName())
                        .description(request.getDescription())
                        .build();
        if (request.getRotationStrategy() != null) {
            pool.setRotationStrategy(request.getRotationStrategy());
        }
        if (request.getCooldownMinutes() != null) {
            pool.setCooldownMinutes(request.getCooldownMinutes());
        }
        if (request.getMaxPostsPerDay() != null) {
            pool.setMaxPostsPerDay(request.getMaxPostsPerDay());
        }
        if (request.getAutoFailover() != null) {
            pool.setAutoFailover(request.getAutoFailover());
        }
        AccountPool saved = accountPoolRepository.save(pool);
        log.info(
                "Created {} pool {} '{}' for brand {} ({})",
                saved.getPlatform(),
                saved.getId(),
                saved.getName(),
                saved.getBrandId(),
                saved.getRotationStrategy());
        return AccountPoolResponse.fromEntity(saved, 0);
    }

    @Transactional
    public AccountPoolResponse updatePool(Long poolId, UpdatePoolRequest request) {
        AccountPool pool = findPool(poolId);
        if (request.getName() != null && !request.getName().equals(pool.getName())) {
            if (accountPoolRepository.existsByBrandIdAndPlatformAndName(
                    pool.getBrandId(), pool.getPlatform(), request.getName())) {
                throw new InvalidPoolConfigurationException(
                        "Pool name '" + request.getName() + "' is already taken");
            }
            pool.setName(request.getName());
        }
        if (request.getDescription() != null) {
            pool.setDescription(request.getDescription());
        }
        if (request.getRotationStrategy() != null) {
            pool.setRotationStrategy(request.getRotationStrategy());
        }
        if (request.getCooldownMinutes() != null) {
            pool.setCooldownMinutes(request.getCooldownMinutes());
        }
        if (request.getMaxPostsPerDay() != null) {
            pool.setMaxPostsPerDay(request.getMaxPostsPerDay());
        }
        if (request.getAutoFailover() != null) {
            pool.setAutoFailover(request.getAutoFailover());
        }
        if (request.getActive() != null) {
            pool.setActive(request.getActive());
        }
        AccountPool saved = accountPoolRepository.save(pool);
        log.info("Updated pool {}", poolId);
        return AccountPoolResponse.fromEntity(
                saved, poolMembershipRepository.countByAccountPoolId(poolId));
    }

    @Transactional
    public AccountPoolResponse deactivatePool(Long poolId) {
        AccountPool pool = findPool(poolId);
        pool.setActive(false);
        log.info("Deactivated pool {}", poolId);
        return AccountPoolResponse.fromEntity(
                accountPoolRepository.save(pool), poolMembershipRepository.countByAccountPoolId(poolId));
    }

    @Transactional(readOnly = true)
    public AccountPoolResponse getPool(Long poolId) {
        return AccountPoolResponse.fromEntity(
                findPool(poolId), poolMembershipRepository.countByAccountPoolId(poolId));
    }

    @Transactional(readOnly = true)
    public List<AccountPoolResponse> listBrandPools(Long brandId) {
        return accountPoolRepository.findByBrandIdOrderByIdAsc(brandId).stream()
                .map(
                        pool ->
                                AccountPoolResponse.fromEntity(
                                        pool, poolMembershipRepository.countByAccountPoolId(pool.getId())))
                .toList();
    }

    /** Members must be linked to the pool's platform; an account joins a pool at most once. */
    @Transactional
    public PoolMembershipResponse addMember(Long poolId, AddMemberRequest request) {
        AccountPool pool = findPool(poolId);
        SocialAccount account =
                socialAccountRepository
                        .findById(request.getSocialAccountId())
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "SocialAccount", request.getSocialAccountId()));
        if (account.getPlatform() != pool.getPlatform()) {
            throw new InvalidPoolConfigurationException(
                    String.format(
                            "Account %d is a %s account and cannot join %s pool %d",
                            account.getId(), account.getPlatform(), pool.getPlatform(), poolId));
        }
        if (!account.isActive()) {
            throw new InvalidPoolConfigurationException(
                    "Account " + account.getId() + " is deactivated");
        }
        if (poolMembershipRepository.existsByAccountPoolIdAndSocialAccountId(poolId, account.getId())) {
            throw new InvalidPoolConfigurationException(
                    "Account " + account.getId() + " is already a member of pool " + poolId);
        }

        PoolMembership membership =
                PoolMembership.builder().accountPool(pool).socialAccount(account).build();
        if (request.getPriority() != null) {
            membership.setPriority(request.getPriority());
        }
        if (request.getWeight() != null) {
            membership.setWeight(request.getWeight());
        }
        PoolMembership saved = poolMembershipRepository.save(membership);
        log.info("Added account {} to pool {} as membership {}", account.getId(), poolId, saved.getId());
        return PoolMembershipResponse.fromEntityWithFetchedAccount(saved, LocalDateTime.now(clock));
    }

    @Transactional
    public PoolMembershipResponse updateMember(Long membershipId, UpdateMemberRequest request) {
        PoolMembership membership = findMembership(membershipId);
        if (request.getPriority() != null) {
            membership.setPriority(request.getPriority());
        }
        if (request.getWeight() != null) {
            membership.setWeight(request.getWeight());
        }
        PoolMembership saved = poolMembershipRepository.save(membership);
        return PoolMembershipResponse.fromEntityWithFetchedAccount(saved, LocalDateTime.now(clock));
    }

    /** Removing a member mid-dispatch is refused; the outcome would have nowhere to land. */
    @Transactional
    public void removeMember(Long membershipId) {
        PoolMembership membership = findMembership(membershipId);
        if (membership.isInFlight()) {
            throw new InvalidPoolConfigurationException(
                    "Membership " + membershipId + " is in use by a dispatch");
        }
        poolMembershipRepository.delete(membership);
        log.info(
                "Removed account {} from pool {}",
                membership.getAccountId(),
                membership.getAccountPool().getId());
    }

    @Transactional(readOnly = true)
    public PoolMembershipResponse getMember(Long membershipId) {
        return PoolMembershipResponse.fromEntityWithFetchedAccount(
                findMembership(membershipId), LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public List<PoolMembershipResponse> listMembers(Long poolId) {
        findPool(poolId);
        LocalDateTime now = LocalDateTime.now(clock);
        return poolMembershipRepository.findByPoolIdWithAccount(poolId).stream()
                .map(m -> PoolMembershipResponse.fromEntityWithFetchedAccount(m, now))
                .toList();
    }

    /** The member the next dispatch would try first. Reserves nothing. */
    @Transactional(readOnly = true)
    public Optional<PoolMembershipResponse> previewNextAccount(Long poolId) {
        AccountPool pool = findPool(poolId);
        LocalDateTime now = LocalDateTime.now(clock);
        List<PoolMembership> candidates =
                poolMembershipRepository.findByPoolIdWithAccount(poolId).stream()
                        .filter(m -> !m.isInFlight())
                        .toList();
        return rotationSelector
                .selectNext(pool, candidates, Collections.emptySet(), now)
                .map(m -> PoolMembershipResponse.fromEntityWithFetchedAccount(m, now));
    }

    private AccountPool findPool(Long poolId) {
        return accountPoolRepository
                .findById(poolId)
                .orElseThrow(() -> new ResourceNotFoundException("AccountPool", poolId));
    }

    private PoolMembership findMembership(Long membershipId) {
        return poolMembershipRepository
                .findByIdWithPoolAndAccount(membershipId)
                .orElseThrow(() -> new ResourceNotFoundException("PoolMembership", membershipId));
    }
}
