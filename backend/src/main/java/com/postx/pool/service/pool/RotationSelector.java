package com.postx.pool.service.pool;

import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.RotationStrategy;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

/**
 * Rotation decision logic. Stateless: every call works on the membership state it is handed, so
 * any number of service instances can rotate the same pool without sharing a cursor.
 *
 * <p>Never returns a member whose account is excluded, that is banned or suspended, that is
 * cooling down, or that has reached the pool's daily cap.
 */
@Component
public class RotationSelector {

    // Oldest use first, never-used members ahead of everything else
    private static final Comparator<PoolMembership> BY_LAST_USED =
            Comparator.comparing(
                    PoolMembership::getLastUsedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final Comparator<PoolMembership> BY_ACCOUNT_ID =
            Comparator.comparing(
                    PoolMembership::getAccountId, Comparator.nullsLast(Comparator.naturalOrder()));

    static final Comparator<PoolMembership> ROUND_ROBIN_ORDER =
            BY_LAST_USED.thenComparing(BY_ACCOUNT_ID);

    static final Comparator<PoolMembership> LEAST_USED_ORDER =
            Comparator.comparingLong(PoolMembership::getTotalPosts)
                    .thenComparing(BY_LAST_USED)
                    .thenComparing(BY_ACCOUNT_ID);

    static final Comparator<PoolMembership> PRIORITY_ORDER =
            Comparator.comparingInt(PoolMembership::getPriority).thenComparing(LEAST_USED_ORDER);

    private final Random random;

    public RotationSelector() {
        this(null);
    }

    /** @param random fixed source for reproducible RANDOM picks; {@code null} uses the thread-local one */
    public RotationSelector(Random random) {
        this.random = random;
    }

    public Optional<PoolMembership> selectNext(
            AccountPool pool,
            List<PoolMembership> memberships,
            Set<Long> excludedAccountIds,
            LocalDateTime now) {
        List<PoolMembership> eligible = eligibleCandidates(pool, memberships, excludedAccountIds, now);
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        if (pool.getRotationStrategy() == RotationStrategy.RANDOM) {
            return Optional.of(eligible.get(random().nextInt(eligible.size())));
        }
        return eligible.stream().min(orderFor(pool.getRotationStrategy()));
    }

    /**
     * All eligible candidates in the order the strategy would pick them. The first element is what
     * {@link #selectNext} returns for the deterministic strategies; for RANDOM the list is a uniform
     * shuffle. Callers that lose a reservation race fall through to the next element.
     */
    public List<PoolMembership> rankCandidates(
            AccountPool pool,
            List<PoolMembership> memberships,
            Set<Long> excludedAccountIds,
            LocalDateTime now) {
        List<PoolMembership> eligible = eligibleCandidates(pool, memberships, excludedAccountIds, now);
        if (pool.getRotationStrategy() == RotationStrategy.RANDOM) {
            Collections.shuffle(eligible, random());
        } else {
            eligible.sort(orderFor(pool.getRotationStrategy()));
        }
        return eligible;
    }

    public boolean isEligible(
            AccountPool pool, PoolMembership membership, Set<Long> excludedAccountIds, LocalDateTime now) {
        if (excludedAccountIds != null && excludedAccountIds.contains(membership.getAccountId())) {
            return false;
        }
        return membership.isEligible(now, pool.getMaxPostsPerDay());
    }

    private List<PoolMembership> eligibleCandidates(
            AccountPool pool,
            List<PoolMembership> memberships,
            Set<Long> excludedAccountIds,
            LocalDateTime now) {
        List<PoolMembership> eligible = new ArrayList<>();
        if (memberships == null) {
            return eligible;
        }
        for (PoolMembership membership : memberships) {
            if (isEligible(pool, membership, excludedAccountIds, now)) {
                eligible.add(membership);
            }
        }
        return eligible;
    }

    static Comparator<PoolMembership> orderFor(RotationStrategy strategy) {
        return switch (strategy) {
            case LEAST_USED -> LEAST_USED_ORDER;
            case PRIORITY -> PRIORITY_ORDER;
            case ROUND_ROBIN, RANDOM -> ROUND_ROBIN_ORDER;
        };
    }

    private Random random() {
        return random != null ? random : ThreadLocalRandom.current();
    }
}
