package com.postx.pool.service.dispatch;

import com.postx.pool.config.PoolProperties;
import com.postx.pool.config.Resilience4jConfig;
import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.PublishErrorKind;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.exception.DispatchCapacityException;
import com.postx.pool.exception.PoolExhaustedException;
import com.postx.pool.exception.PoolNotConfiguredException;
import com.postx.pool.monitoring.DispatchMetrics;
import com.postx.pool.publisher.PlatformPublisher;
import com.postx.pool.publisher.PlatformPublisherRegistry;
import com.postx.pool.publisher.PostContent;
import com.postx.pool.publisher.PublishException;
import com.postx.pool.publisher.PublishReceipt;
import com.postx.pool.service.audit.DispatchAuditService;
import com.postx.pool.service.health.AccountHealthService;
import com.postx.pool.service.health.PublishOutcome;
import com.postx.pool.service.pool.PoolRegistryService;
import com.postx.pool.service.pool.RotationSelector;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Entry point for publishing through an account pool.
 *
 * <p>A dispatch is a bounded failover loop. Each attempt reserves one member, publishes through
 * the platform's publisher outside any transaction, and records the outcome before the next
 * attempt reads pool state again. Accounts that already failed in this dispatch are excluded from
 * later attempts. When the attempts run out without a publish the dispatch ends as pool-exhausted.
 */
@Slf4j
@Service
public class DispatchService {

    private final PoolRegistryService poolRegistryService;
    private final RotationSelector rotationSelector;
    private final MembershipReservationService reservationService;
    private final AccountHealthService accountHealthService;
    private final DispatchAuditService auditService;
    private final PlatformPublisherRegistry publisherRegistry;
    private final DispatchMetrics dispatchMetrics;
    private final PoolProperties poolProperties;
    private final TimeLimiter publishTimeLimiter;
    private final AsyncTaskExecutor publishExecutor;
    private final Clock clock;

    public DispatchService(
            PoolRegistryService poolRegistryService,
            RotationSelector rotationSelector,
            MembershipReservationService reservationService,
            AccountHealthService accountHealthService,
            DispatchAuditService auditService,
            PlatformPublisherRegistry publisherRegistry,
            DispatchMetrics dispatchMetrics,
            PoolProperties poolProperties,
            TimeLimiter publishTimeLimiter,
            @Qualifier("publishExecutor") AsyncTaskExecutor publishExecutor,
            Clock clock) {
        this.poolRegistryService = poolRegistryService;
        this.rotationSelector = rotationSelector;
        this.reservationService = reservationService;
        this.accountHealthService = accountHealthService;
        this.auditService = auditService;
        this.publisherRegistry = publisherRegistry;
        this.dispatchMetrics = dispatchMetrics;
        this.poolProperties = poolProperties;
        this.publishTimeLimiter = publishTimeLimiter;
        this.publishExecutor = publishExecutor;
        this.clock = clock;
    }

    /**
     * Publishes {@code content} for the brand on the platform through one of the pool's accounts,
     * with the configured publish timeout.
     *
     * @throws PoolNotConfiguredException when the brand has no active pool for the platform
     * @throws PoolExhaustedException when no eligible member is left or every attempt failed
     */
    public DispatchResult dispatch(Long brandId, Platform platform, PostContent content) {
        return dispatch(brandId, platform, content, null);
    }

    /**
     * Same as {@link #dispatch(Long, Platform, PostContent)} with a per-attempt publish timeout.
     * The timeout never exceeds the configured publish timeout; {@code null} means the configured
     * one.
     */
    public DispatchResult dispatch(
            Long brandId, Platform platform, PostContent content, Duration publishTimeout) {
        TimeLimiter timeLimiter = timeLimiterFor(publishTimeout);
        String dispatchId = UUID.randomUUID().toString();
        Timer.Sample sample = dispatchMetrics.startDispatchTimer();
        try {
            AccountPool pool;
            try {
                pool = poolRegistryService.getPool(brandId, platform);
            } catch (PoolNotConfiguredException e) {
                dispatchMetrics.incrementPoolNotConfigured();
                log.warn("Dispatch {} rejected: {}", dispatchId, e.getMessage());
                throw e;
            }
            DispatchResult result = runAttempts(dispatchId, pool, content, timeLimiter);
            dispatchMetrics.recordResult(platform, result.getStatus());
            return result;
        } finally {
            dispatchMetrics.recordDispatchTime(sample, platform);
        }
    }

    private TimeLimiter timeLimiterFor(Duration requested) {
        if (requested == null) {
            return publishTimeLimiter;
        }
        if (requested.isZero() || requested.isNegative()) {
            throw new IllegalArgumentException("Publish timeout must be positive: " + requested);
        }
        TimeLimiterConfig configured = publishTimeLimiter.getTimeLimiterConfig();
        if (requested.compareTo(configured.getTimeoutDuration()) >= 0) {
            return publishTimeLimiter;
        }
        return TimeLimiter.of(
                Resilience4jConfig.PUBLISH_TIME_LIMITER,
                TimeLimiterConfig.from(configured).timeoutDuration(requested).build());
    }

    private DispatchResult runAttempts(
            String dispatchId, AccountPool pool, PostContent content, TimeLimiter timeLimiter) {
        PlatformPublisher publisher = publisherRegistry.publisherFor(pool.getPlatform());
        int memberCount = pool.getMemberships().size();
        int maxAttempts =
                pool.isAutoFailover()
                        ? Math.min(poolProperties.getDispatch().getMaxAttempts(), memberCount)
                        : Math.min(1, memberCount);

        log.info(
                "Dispatch {} for brand {} on {} via pool {} ({}, {} members, up to {} attempts, timeout {})",
                dispatchId,
                pool.getBrandId(),
                pool.getPlatform(),
                pool.getId(),
                pool.getRotationStrategy(),
                memberCount,
                maxAttempts,
                timeLimiter.getTimeLimiterConfig().getTimeoutDuration());

        if (maxAttempts == 0) {
            throw exhausted(dispatchId, pool, 0);
        }

        Set<Long> excluded = new HashSet<>();
        DispatchOutcome lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Reservation reservation = reserveNext(dispatchId, pool, excluded, attempt - 1);
            DispatchOutcome outcome =
                    attempt(dispatchId, pool, publisher, timeLimiter, reservation, content, attempt);

            if (outcome.success()) {
                log.info(
                        "Dispatch {} published as {} by account {} (membership {}) on attempt {}",
                        dispatchId,
                        outcome.postId(),
                        outcome.accountId(),
                        outcome.membershipId(),
                        attempt);
                return DispatchResult.published(dispatchId, outcome, pool.getPlatform());
            }

            excluded.add(outcome.accountId());
            lastFailure = outcome;

            if (!outcome.errorKind().isRetryableOnOtherAccount()) {
                log.warn(
                        "Dispatch {} stopped: {} is a content-level error, skipping failover",
                        dispatchId,
                        outcome.errorKind());
                return DispatchResult.contentRejected(dispatchId, outcome, pool.getPlatform());
            }
        }

        throw exhausted(dispatchId, pool, lastFailure.attemptNumber(), lastFailure.errorKind());
    }

    /**
     * Reserves the best eligible member. Members held by other dispatches are skipped; if they are
     * the only candidates left, waits for them up to the configured reservation wait.
     */
    private Reservation reserveNext(
            String dispatchId, AccountPool pool, Set<Long> excluded, int attemptsSoFar) {
        PoolProperties.Dispatch config = poolProperties.getDispatch();
        long deadline = System.nanoTime() + config.getReservationWait().toNanos();

        while (true) {
            LocalDateTime now = LocalDateTime.now(clock);
            List<PoolMembership> candidates = poolRegistryService.listCandidates(pool.getId());
            List<PoolMembership> ranked = rotationSelector.rankCandidates(pool, candidates, excluded, now);

            boolean contended = false;
            for (PoolMembership candidate : ranked) {
                if (candidate.isInFlight()) {
                    contended = true;
                    continue;
                }
                Optional<String> token =
                        reservationService.tryReserve(candidate.getId(), pool.getMaxPostsPerDay());
                if (token.isPresent()) {
                    return new Reservation(candidate, token.get());
                }
                dispatchMetrics.incrementReservationConflict();
                contended = true;
            }

            if (!contended || System.nanoTime() >= deadline) {
                throw exhausted(dispatchId, pool, attemptsSoFar);
            }
            try {
                TimeUnit.MILLISECONDS.sleep(config.getReservationPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw exhausted(dispatchId, pool, attemptsSoFar);
            }
        }
    }

    private DispatchOutcome attempt(
            String dispatchId,
            AccountPool pool,
            PlatformPublisher publisher,
            TimeLimiter timeLimiter,
            Reservation reservation,
            PostContent content,
            int attemptNumber) {
        PoolMembership membership = reservation.membership();
        SocialAccount account = membership.getSocialAccount();

        PublishOutcome publishOutcome;
        boolean recorded = false;
        try {
            publishOutcome = publish(dispatchId, publisher, timeLimiter, account, content);
            accountHealthService.recordOutcome(membership.getId(), publishOutcome, reservation.token());
            recorded = true;
        } finally {
            if (!recorded) {
                log.error(
                        "Dispatch {} attempt on membership {} did not complete, releasing reservation",
                        dispatchId,
                        membership.getId());
                reservationService.release(membership.getId(), reservation.token());
            }
        }

        DispatchOutcome outcome =
                new DispatchOutcome(
                        dispatchId,
                        pool.getId(),
                        membership.getId(),
                        account.getId(),
                        pool.getPlatform(),
                        attemptNumber,
                        publishOutcome.isSuccess(),
                        publishOutcome.getErrorKind(),
                        publishOutcome.getErrorMessage(),
                        publishOutcome.getPostId(),
                        publishOutcome.getUrl(),
                        publishOutcome.getLatencyMs(),
                        LocalDateTime.now(clock));

        if (!outcome.success()) {
            log.warn(
                    "Dispatch {} attempt {} on pool {} membership {} failed at {}: {} {}",
                    dispatchId,
                    attemptNumber,
                    pool.getId(),
                    membership.getId(),
                    outcome.timestamp(),
                    outcome.errorKind(),
                    outcome.errorMessage());
        }
        auditService.recordAttempt(outcome);
        dispatchMetrics.recordAttempt(pool.getPlatform(), outcome.errorKind(), outcome.latencyMs());
        return outcome;
    }

    private PublishOutcome publish(
            String dispatchId,
            PlatformPublisher publisher,
            TimeLimiter timeLimiter,
            SocialAccount account,
            PostContent content) {
        long start = System.nanoTime();
        try {
            // The executor's future interrupts the worker when the limiter cancels it
            PublishReceipt receipt =
                    timeLimiter.executeFutureSupplier(
                            () -> publishExecutor.submit(() -> publisher.publish(account, content)));
            if (receipt == null) {
                return PublishOutcome.failure(
                        PublishErrorKind.PLATFORM_ERROR, "Publisher returned no receipt", elapsedMs(start));
            }
            return PublishOutcome.success(receipt.postId(), receipt.url(), elapsedMs(start));
        } catch (TimeoutException e) {
            return PublishOutcome.failure(
                    PublishErrorKind.NETWORK_ERROR,
                    "Publish timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(),
                    elapsedMs(start));
        } catch (RejectedExecutionException e) {
            dispatchMetrics.incrementPublishRejected();
            log.error(
                    "Dispatch {} publish for account {} rejected by the publish executor",
                    dispatchId,
                    account.getId());
            throw new DispatchCapacityException(dispatchId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PublishOutcome.failure(
                    PublishErrorKind.NETWORK_ERROR, "Publish interrupted", elapsedMs(start));
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (cause instanceof PublishException) {
                PublishException publishException = (PublishException) cause;
                return PublishOutcome.failure(
                        publishException.getKind(), publishException.getMessage(), elapsedMs(start));
            }
            log.error(
                    "Unclassified publish failure for account {}: {}",
                    account.getId(),
                    cause.getMessage(),
                    cause);
            return PublishOutcome.failure(
                    PublishErrorKind.UNKNOWN,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                    elapsedMs(start));
        }
    }

    private PoolExhaustedException exhausted(String dispatchId, AccountPool pool, int attempts) {
        return exhausted(dispatchId, pool, attempts, null);
    }

    private PoolExhaustedException exhausted(
            String dispatchId, AccountPool pool, int attempts, PublishErrorKind lastErrorKind) {
        dispatchMetrics.incrementPoolExhausted();
        log.error(
                "Dispatch {} exhausted pool {} (brand {}, {}) after {} attempt(s), last error {}",
                dispatchId,
                pool.getId(),
                pool.getBrandId(),
                pool.getPlatform(),
                attempts,
                lastErrorKind);
        return new PoolExhaustedException(pool.getId(), attempts, lastErrorKind);
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof ExecutionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record Reservation(PoolMembership membership, String token) {}
}
