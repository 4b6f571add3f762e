package com.postx.pool.health;

import com.postx.pool.service.pool.PoolHealthService;
import com.postx.pool.service.pool.PoolHealthSummary;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reports DOWN when an active pool has no member it could dispatch through right now. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountPoolHealthIndicator implements HealthIndicator {

    private final PoolHealthService poolHealthService;

    @Override
    public Health health() {
        try {
            List<PoolHealthSummary> active =
                    poolHealthService.getAllPoolHealth().stream()
                            .filter(PoolHealthSummary::isActive)
                            .toList();
            List<Long> exhausted =
                    active.stream()
                            .filter(summary -> !summary.isHealthy())
                            .map(PoolHealthSummary::getPoolId)
                            .toList();

            Health.Builder builder = exhausted.isEmpty() ? Health.up() : Health.down();
            return builder.withDetail("activePools", active.size())
                    .withDetail("exhaustedPools", exhausted)
                    .withDetail(
                            "availableAccounts",
                            active.stream().mapToInt(PoolHealthSummary::getAvailableNow).sum())
                    .withDetail(
                            "cooldownAccounts",
                            active.stream().mapToInt(PoolHealthSummary::getCooldownCount).sum())
                    .withDetail(
                            "bannedAccounts",
                            active.stream().mapToInt(PoolHealthSummary::getBannedCount).sum())
                    .build();
        } catch (Exception e) {
            log.error("Account pool health check error: {}", e.getMessage());
            return Health.down().withDetail("error", e.getMessage()).build();
        }
    }
}
