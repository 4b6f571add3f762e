package com.postx.pool.service.health;

import com.postx.pool.config.PoolProperties;
import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.EventTrigger;
import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.PublishErrorKind;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.entity.StatusEventType;
import com.postx.pool.exception.ResourceNotFoundException;
import com.postx.pool.repository.PoolMembershipRepository;
import com.postx.pool.repository.SocialAccountRepository;
import com.postx.pool.service.audit.DispatchAuditService;
import com.postx.pool.service.credential.CredentialBackupService;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Health and cooldown bookkeeping for pool members.
 *
 * <p>Every mutation locks the membership row first and the account row second. Publish calls
 * never run inside these transactions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountHealthService {

    private final PoolMembershipRepository poolMembershipRepository;
    private final SocialAccountRepository socialAccountRepository;
    private final DispatchAuditService auditService;
    private final CredentialBackupService credentialBackupService;
    private final PoolProperties poolProperties;
    private final Clock clock;

    @Transactional
    public PoolMembership recordOutcome(Long membershipId, PublishOutcome outcome) {
        return recordOutcome(membershipId, outcome, null);
    }

    /**
     * Applies one publish outcome to the membership and its account.
     *
     * <p>When {@code reservationToken} matches the membership's live reservation, the reservation
     * is released: a success keeps the daily slot it already took, a failure gives it back. Without
     * a matching reservation a success takes a new daily slot.
     */
    @Transactional
    public PoolMembership recordOutcome(
            Long membershipId, PublishOutcome outcome, String reservationToken) {
        PoolMembership membership = lockMembership(membershipId);
        SocialAccount account = lockAccount(membership);
        AccountPool pool = membership.getAccountPool();
        LocalDateTime now = LocalDateTime.now(clock);
        int errorThreshold = poolProperties.getHealth().getAccountErrorThreshold();

        expireCooldownIfDue(membership, now);
        MembershipStatus before = membership.getStatus();

        boolean reserved = membership.holdsReservation(reservationToken);
        if (reservationToken != null && !reserved) {
            log.warn(
                    "Reservation {} on membership {} is no longer held; recording outcome without it",
                    reservationToken,
                    membershipId);
        }
        if (reserved) {
            membership.releaseReservation();
        }

        if (outcome.isSuccess()) {
            applySuccess(membership, reserved, now);
            account.recordSuccess(now, errorThreshold);
        } else {
            applyFailure(membership, pool, outcome, reserved, now);
            if (outcome.getErrorKind() == PublishErrorKind.ACCOUNT_BANNED) {
                account.signalBanned();
            } else if (outcome.getErrorKind() == PublishErrorKind.ACCOUNT_SUSPENDED) {
                account.signalSuspended();
            } else if (outcome.getErrorKind() == PublishErrorKind.RATE_LIMITED
                    && membership.getCooldownUntil() != null) {
                account.coolDownUntil(membership.getCooldownUntil());
            }
            account.recordFailure(outcome.describeError(), now, errorThreshold);
        }

        if (membership.getStatus() != before) {
            auditService.recordStatusChange(
                    membership,
                    eventTypeFor(membership.getStatus(), before),
                    before,
                    membership.getStatus(),
                    membership.getLastError(),
                    EventTrigger.SYSTEM);
        }

        socialAccountRepository.save(account);
        return poolMembershipRepository.save(membership);
    }

    private void applySuccess(PoolMembership membership, boolean reserved, LocalDateTime now) {
        membership.setSuccessCount(membership.getSuccessCount() + 1);
        membership.setTotalPosts(membership.getTotalPosts() + 1);
        if (!reserved) {
            membership.setPostsToday(membership.getPostsToday() + 1);
        }
        membership.setConsecutiveFailures(0);
        membership.setRateLimitStreak(0);
        membership.setLastUsedAt(now);
        membership.setLastError(null);
        // Banned and suspended members only come back through an operator reset
        if (!membership.getStatus().isTerminal()) {
            membership.setStatus(MembershipStatus.ACTIVE);
            membership.setCooldownUntil(null);
        }
    }

    private void applyFailure(
            PoolMembership membership,
            AccountPool pool,
            PublishOutcome outcome,
            boolean reserved,
            LocalDateTime now) {
        PoolProperties.Health health = poolProperties.getHealth();
        PublishErrorKind kind = outcome.getErrorKind();

        membership.setFailureCount(membership.getFailureCount() + 1);
        membership.setConsecutiveFailures(membership.getConsecutiveFailures() + 1);
        membership.setLastUsedAt(now);
        membership.setLastFailureAt(now);
        membership.setLastError(outcome.describeError());
        if (reserved) {
            membership.setPostsToday(Math.max(0, membership.getPostsToday() - 1));
        }
        membership.setRateLimitStreak(
                kind == PublishErrorKind.RATE_LIMITED ? membership.getRateLimitStreak() + 1 : 0);

        MembershipStatus current = membership.getStatus();
        MembershipStatus next = current;
        LocalDateTime cooldownUntil = null;

        switch (kind) {
            case RATE_LIMITED -> {
                next = MembershipStatus.COOLDOWN;
                cooldownUntil =
                        now.plus(rateLimitCooldown(pool.getCooldownDuration(), membership.getRateLimitStreak()));
            }
            case ACCOUNT_BANNED -> next = MembershipStatus.BANNED;
            case ACCOUNT_SUSPENDED -> next = MembershipStatus.SUSPENDED;
            case AUTHENTICATION_ERROR, TOKEN_EXPIRED ->
                    next =
                            membership.getConsecutiveFailures() >= health.getAuthFailureSuspendThreshold()
                                    ? MembershipStatus.SUSPENDED
                                    : MembershipStatus.ERROR;
            default -> {
                if (membership.getConsecutiveFailures() >= health.getTransientFailureCooldownThreshold()) {
                    next = MembershipStatus.COOLDOWN;
                    cooldownUntil = now.plus(pool.getCooldownDuration());
                }
            }
        }

        // A ban outranks everything; a suspension outranks all but a ban
        if (current == MembershipStatus.BANNED
                || (current == MembershipStatus.SUSPENDED && next != MembershipStatus.BANNED)) {
            next = current;
        }

        membership.setStatus(next);
        if (next == MembershipStatus.COOLDOWN) {
            if (cooldownUntil != null) {
                membership.setCooldownUntil(cooldownUntil);
            }
        } else {
            membership.setCooldownUntil(null);
        }

        log.warn(
                "Pool {} membership {} (account {}) failed with {}: status {} -> {}{}",
                pool.getId(),
                membership.getId(),
                membership.getAccountId(),
                kind,
                current,
                next,
                next == MembershipStatus.COOLDOWN ? " until " + membership.getCooldownUntil() : "");
    }

    /**
     * Cooldown after the n-th consecutive rate limit: the base duration multiplied by the backoff
     * multiplier once per rate limit beyond the first, capped at the configured maximum.
     */
    Duration rateLimitCooldown(Duration base, int streak) {
        PoolProperties.Health health = poolProperties.getHealth();
        Duration max = health.getMaxCooldown();
        double factor = Math.pow(health.getRateLimitBackoffMultiplier(), Math.max(0, streak - 1));
        double millis = base.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Operator override: back to ACTIVE with cooldown, failure streak and account signals cleared.
     * A member coming back from ERROR or SUSPENDED also gets its credentials restored from the
     * latest valid backup, when one exists.
     */
    @Transactional
    public PoolMembership resetMembership(Long membershipId) {
        PoolMembership membership = lockMembership(membershipId);
        SocialAccount account = lockAccount(membership);
        LocalDateTime now = LocalDateTime.now(clock);
        MembershipStatus before = membership.getStatus();

        membership.setStatus(MembershipStatus.ACTIVE);
        membership.setCooldownUntil(null);
        membership.setConsecutiveFailures(0);
        membership.setRateLimitStreak(0);
        membership.setLastError(null);
        account.clearSignals(now, poolProperties.getHealth().getAccountErrorThreshold());

        // Error and suspension usually mean the live token went bad
        boolean restored =
                (before == MembershipStatus.ERROR || before == MembershipStatus.SUSPENDED)
                        && credentialBackupService.restoreCredentials(account);

        auditService.recordStatusChange(
                membership,
                StatusEventType.ACCOUNT_RECOVERED,
                before,
                MembershipStatus.ACTIVE,
                restored ? "Reset by operator; credentials restored from backup" : "Reset by operator",
                EventTrigger.OPERATOR);
        log.info(
                "Membership {} reset by operator from {}{}",
                membershipId,
                before,
                restored ? ", credentials restored" : "");

        socialAccountRepository.save(account);
        return poolMembershipRepository.save(membership);
    }

    /** Zeroes every daily counter. Running it twice is the same as running it once. */
    @Transactional
    public int resetDailyCounters() {
        int memberships = poolMembershipRepository.resetAllPostsToday();
        int accounts = socialAccountRepository.resetAllPostsUsedToday();
        log.info("Daily counters reset for {} memberships and {} accounts", memberships, accounts);
        return memberships;
    }

    /**
     * Force-releases a reservation older than {@code cutoff}. The daily slot it took is returned;
     * no failure is counted against the member.
     *
     * @return the token of the released reservation, or {@code null} when nothing was stale
     */
    @Transactional
    public String releaseStaleReservation(Long membershipId, LocalDateTime cutoff) {
        PoolMembership membership = lockMembership(membershipId);
        if (!membership.isInFlight()
                || membership.getReservedAt() == null
                || !membership.getReservedAt().isBefore(cutoff)) {
            return null;
        }
        String token = membership.getReservationToken();
        LocalDateTime reservedAt = membership.getReservedAt();
        membership.releaseReservation();
        membership.setPostsToday(Math.max(0, membership.getPostsToday() - 1));

        auditService.recordStatusChange(
                membership,
                StatusEventType.RESERVATION_EXPIRED,
                membership.getStatus(),
                membership.getStatus(),
                "Reservation held since " + reservedAt + " released",
                EventTrigger.SYSTEM);
        log.warn(
                "Released stale reservation {} on membership {} (held since {})",
                token,
                membershipId,
                reservedAt);
        poolMembershipRepository.save(membership);
        return token;
    }

    /** Rewrites a lapsed COOLDOWN as ACTIVE. Selection never waits for this. */
    @Transactional
    public boolean endExpiredCooldown(Long membershipId) {
        PoolMembership membership = lockMembership(membershipId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (!expireCooldownIfDue(membership, now)) {
            return false;
        }
        SocialAccount account = lockAccount(membership);
        account.refreshHealthStatus(now, poolProperties.getHealth().getAccountErrorThreshold());
        socialAccountRepository.save(account);
        poolMembershipRepository.save(membership);
        return true;
    }

    private boolean expireCooldownIfDue(PoolMembership membership, LocalDateTime now) {
        if (membership.getStatus() != MembershipStatus.COOLDOWN || membership.isCoolingDown(now)) {
            return false;
        }
        LocalDateTime endedAt = membership.getCooldownUntil();
        membership.setStatus(MembershipStatus.ACTIVE);
        membership.setCooldownUntil(null);
        auditService.recordStatusChange(
                membership,
                StatusEventType.COOLDOWN_ENDED,
                MembershipStatus.COOLDOWN,
                MembershipStatus.ACTIVE,
                "Cooldown ended at " + endedAt,
                EventTrigger.SYSTEM);
        return true;
    }

    private static StatusEventType eventTypeFor(MembershipStatus status, MembershipStatus before) {
        return switch (status) {
            case COOLDOWN -> StatusEventType.COOLDOWN_STARTED;
            case BANNED -> StatusEventType.ACCOUNT_BANNED;
            case SUSPENDED -> StatusEventType.ACCOUNT_SUSPENDED;
            case ERROR -> StatusEventType.ACCOUNT_ERROR;
            case ACTIVE ->
                    before == MembershipStatus.COOLDOWN
                            ? StatusEventType.COOLDOWN_ENDED
                            : StatusEventType.ACCOUNT_RECOVERED;
        };
    }

    private PoolMembership lockMembership(Long membershipId) {
        return poolMembershipRepository
                .findByIdWithLock(membershipId)
                .orElseThrow(() -> new ResourceNotFoundException("PoolMembership", membershipId));
    }

    private SocialAccount lockAccount(PoolMembership membership) {
        Long accountId = membership.getAccountId();
        return socialAccountRepository
                .findByIdWithLock(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("SocialAccount", accountId));
    }
}
