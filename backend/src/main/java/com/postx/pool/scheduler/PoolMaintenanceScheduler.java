package com.postx.pool.scheduler;

import com.postx.pool.config.PoolProperties;
import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.monitoring.DispatchMetrics;
import com.postx.pool.repository.PoolMembershipRepository;
import com.postx.pool.service.health.AccountHealthService;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background upkeep for account pools: the daily counter reset, the stale reservation sweep and
 * the cooldown sweep. Selection stays correct if the cooldown sweep never runs; the reservation
 * sweep is what frees members left in flight by a crashed dispatch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "app.scheduling.pool-maintenance.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class PoolMaintenanceScheduler {

    private final AccountHealthService accountHealthService;
    private final PoolMembershipRepository poolMembershipRepository;
    private final DispatchMetrics dispatchMetrics;
    private final PoolProperties poolProperties;
    private final Clock clock;

    @Scheduled(
            cron = "${app.pool.sweep.daily-reset-cron:0 0 0 * * *}",
            zone = "${app.pool.sweep.daily-reset-zone:UTC}")
    public void resetDailyCounters() {
        try {
            int reset = accountHealthService.resetDailyCounters();
            log.info("Daily pool counter reset completed: {} memberships", reset);
        } catch (Exception e) {
            log.error("Daily pool counter reset failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${app.pool.sweep.stale-reservation-interval-ms:60000}")
    public void releaseStaleReservations() {
        Duration maxHold =
                poolProperties
                        .getDispatch()
                        .getPublishTimeout()
                        .multipliedBy(poolProperties.getSweep().getStaleReservationFactor());
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(maxHold);
        List<Long> staleIds = poolMembershipRepository.findStaleReservationIds(cutoff);
        if (staleIds.isEmpty()) {
            return;
        }

        int released = 0;
        for (Long membershipId : staleIds) {
            try {
                if (accountHealthService.releaseStaleReservation(membershipId, cutoff) != null) {
                    released++;
                }
            } catch (Exception e) {
                log.error(
                        "Failed to release stale reservation on membership {}: {}",
                        membershipId,
                        e.getMessage(),
                        e);
            }
        }
        dispatchMetrics.incrementStaleReservations(released);
        log.warn("Released {} of {} stale reservations older than {}", released, staleIds.size(), cutoff);
    }

    @Scheduled(fixedDelayString = "${app.pool.sweep.cooldown-interval-ms:60000}")
    public void endExpiredCooldowns() {
        List<Long> expired =
                poolMembershipRepository.findExpiredCooldownIds(
                        MembershipStatus.COOLDOWN, LocalDateTime.now(clock));
        int ended = 0;
        for (Long membershipId : expired) {
            try {
                if (accountHealthService.endExpiredCooldown(membershipId)) {
                    ended++;
                }
            } catch (Exception e) {
                log.error(
                        "Failed to end cooldown on membership {}: {}", membershipId, e.getMessage(), e);
            }
        }
        if (ended > 0) {
            log.info("Returned {} memberships from cooldown to active", ended);
        }
    }
}
