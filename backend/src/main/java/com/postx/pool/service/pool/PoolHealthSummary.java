package com.postx.pool.service.pool;

import com.postx.pool.entity.Platform;
import com.postx.pool.entity.RotationStrategy;
import lombok.Builder;
import lombok.Data;

/** Read-only counts for one pool, as shown on dashboards. */
@Builder
@Data
public class PoolHealthSummary {
    private final Long poolId;
    private final String name;
    private final Platform platform;
    private final RotationStrategy rotationStrategy;
    private final boolean active;
    private final int memberCount;
    private final int activeCount;
    private final int cooldownCount;
    private final int suspendedCount;
    private final int bannedCount;
    private final int errorCount;
    // Eligible right now and not reserved by a dispatch
    private final int availableNow;
    private final int inFlightCount;
    private final long postsToday;
    private final long totalPosts;
    private final double successRate;

    public boolean isHealthy() {
        return active && availableNow > 0;
    }
}
