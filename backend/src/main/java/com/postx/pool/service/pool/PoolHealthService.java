package com.postx.pool.service.pool;

import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.DispatchOutcomeRecord;
import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.entity.MembershipStatusEvent;
import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.PublishErrorKind;
import com.postx.pool.entity.StatusEventType;
import com.postx.pool.exception.ResourceNotFoundException;
import com.postx.pool.repository.AccountPoolRepository;
import com.postx.pool.repository.DispatchOutcomeRecordRepository;
import com.postx.pool.repository.MembershipStatusEventRepository;
import com.postx.pool.repository.PoolMembershipRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PoolHealthService {

    private final AccountPoolRepository accountPoolRepository;
    private final PoolMembershipRepository poolMembershipRepository;
    private final DispatchOutcomeRecordRepository outcomeRecordRepository;
    private final MembershipStatusEventRepository statusEventRepository;
    private final Clock clock;

    /** Counts use the effective status, so a lapsed cooldown counts as active. */
    @Transactional(readOnly = true)
    public PoolHealthSummary getPoolHealth(Long poolId) {
        AccountPool pool =
                accountPoolRepository
                        .findById(poolId)
                        .orElseThrow(() -> new ResourceNotFoundException("AccountPool", poolId));
        List<PoolMembership> memberships = poolMembershipRepository.findByPoolIdWithAccount(poolId);
        return summarize(pool, memberships, LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public List<PoolHealthSummary> getBrandHealth(Long brandId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return accountPoolRepository.findByBrandIdOrderByIdAsc(brandId).stream()
                .map(
                        pool ->
                                summarize(
                                        pool,
                                        poolMembershipRepository.findByPoolIdWithAccount(pool.getId()),
                                        now))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PoolHealthSummary> getAllPoolHealth() {
        LocalDateTime now = LocalDateTime.now(clock);
        return accountPoolRepository.findAll().stream()
                .map(
                        pool ->
                                summarize(
                                        pool,
                                        poolMembershipRepository.findByPoolIdWithAccount(pool.getId()),
                                        now))
                .toList();
    }

    static PoolHealthSummary summarize(
            AccountPool pool, List<PoolMembership> memberships, LocalDateTime now) {
        Map<MembershipStatus, Long> byStatus =
                memberships.stream()
                        .collect(
                                Collectors.groupingBy(
                                        m -> m.effectiveStatus(now),
                                        () -> new EnumMap<>(MembershipStatus.class),
                                        Collectors.counting()));
        int available =
                (int)
                        memberships.stream()
                                .filter(m -> !m.isInFlight() && m.isEligible(now, pool.getMaxPostsPerDay()))
                                .count();
        long successes = memberships.stream().mapToLong(PoolMembership::getSuccessCount).sum();
        long failures = memberships.stream().mapToLong(PoolMembership::getFailureCount).sum();
        double successRate =
                successes + failures == 0
                        ? 100.0
                        : Math.round(successes * 10000.0 / (successes + failures)) / 100.0;

        return PoolHealthSummary.builder()
                .poolId(pool.getId())
                .name(pool.getName())
                .platform(pool.getPlatform())
                .rotationStrategy(pool.getRotationStrategy())
                .active(pool.isActive())
                .memberCount(memberships.size())
                .activeCount(count(byStatus, MembershipStatus.ACTIVE))
                .cooldownCount(count(byStatus, MembershipStatus.COOLDOWN))
                .suspendedCount(count(byStatus, MembershipStatus.SUSPENDED))
                .bannedCount(count(byStatus, MembershipStatus.BANNED))
                .errorCount(count(byStatus, MembershipStatus.ERROR))
                .availableNow(available)
                .inFlightCount((int) memberships.stream().filter(PoolMembership::isInFlight).count())
                .postsToday(memberships.stream().mapToLong(PoolMembership::getPostsToday).sum())
                .totalPosts(memberships.stream().mapToLong(PoolMembership::getTotalPosts).sum())
                .successRate(successRate)
                .build();
    }

    /** Attempt and status-change totals over the last {@code hours} hours, across all pools. */
    @Transactional(readOnly = true)
    public PoolHealthReport getHealthReport(int hours) {
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be at least 1");
        }
        LocalDateTime since = LocalDateTime.now(clock).minusHours(hours);
        List<DispatchOutcomeRecord> records = outcomeRecordRepository.findByCreatedAtAfter(since);
        List<MembershipStatusEvent> events = statusEventRepository.findByCreatedAtAfter(since);
        long suspensions =
                events.stream()
                        .filter(e -> e.getEventType() == StatusEventType.ACCOUNT_SUSPENDED)
                        .count();

        Map<Platform, List<DispatchOutcomeRecord>> grouped =
                records.stream()
                        .collect(
                                Collectors.groupingBy(
                                        DispatchOutcomeRecord::getPlatform,
                                        () -> new EnumMap<>(Platform.class),
                                        Collectors.toList()));
        Map<Platform, PoolHealthReport.PlatformBreakdown> byPlatform = new EnumMap<>(Platform.class);
        grouped.forEach((platform, list) -> byPlatform.put(platform, breakdown(list)));

        PoolHealthReport.PlatformBreakdown total = breakdown(records);
        return PoolHealthReport.builder()
                .since(since)
                .hours(hours)
                .attempts(total.getAttempts())
                .successes(total.getSuccesses())
                .failures(total.getFailures())
                .rateLimits(total.getRateLimits())
                .bans(total.getBans())
                .suspensions(suspensions)
                .statusEvents(events.size())
                .byPlatform(byPlatform)
                .build();
    }

    private static PoolHealthReport.PlatformBreakdown breakdown(List<DispatchOutcomeRecord> records) {
        long successes = records.stream().filter(DispatchOutcomeRecord::isSuccess).count();
        return PoolHealthReport.PlatformBreakdown.builder()
                .attempts(records.size())
                .successes(successes)
                .failures(records.size() - successes)
                .rateLimits(countKind(records, PublishErrorKind.RATE_LIMITED))
                .bans(countKind(records, PublishErrorKind.ACCOUNT_BANNED))
                .build();
    }

    private static long countKind(List<DispatchOutcomeRecord> records, PublishErrorKind kind) {
        return records.stream().filter(r -> r.getErrorKind() == kind).count();
    }

    private static int count(Map<MembershipStatus, Long> byStatus, MembershipStatus status) {
        return byStatus.getOrDefault(status, 0L).intValue();
    }
}
