package com.postx.pool.service.pool;

import com.postx.pool.entity.Platform;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class PoolHealthReport {
    private final LocalDateTime since;
    private final int hours;
    private final long attempts;
    private final long successes;
    private final long failures;
    private final long rateLimits;
    private final long bans;
    private final long suspensions;
    private final long statusEvents;
    private final Map<Platform, PlatformBreakdown> byPlatform;

    @Builder
    @Data
    public static class PlatformBreakdown {
        private final long attempts;
        private final long successes;
        private final long failures;
        private final long rateLimits;
        private final long bans;
    }
}
