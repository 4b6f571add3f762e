package com.postx.pool.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Account pool rotation configuration */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.pool")
public class PoolProperties {

    @Valid private Dispatch dispatch = new Dispatch();
    @Valid private Health health = new Health();
    @Valid private Sweep sweep = new Sweep();
    @Valid private Credentials credentials = new Credentials();

    @Data
    public static class Dispatch {
        @Min(1)
        private int maxAttempts = 3;

        // Upper bound for every publish call; a caller-supplied timeout is capped here
        @NotNull private Duration publishTimeout = Duration.ofSeconds(60);

        // How long a dispatch waits for members reserved by other dispatches to come free
        @NotNull private Duration reservationWait = Duration.ofSeconds(10);

        @NotNull private Duration reservationPollInterval = Duration.ofMillis(100);

        @Min(1)
        private int publishThreads = 16;

        // Publish calls waiting for a worker; beyond this the dispatch is refused
        @Min(0)
        private int publishQueueCapacity = 100;
    }

    @Data
    public static class Health {
        @Min(1)
        private int authFailureSuspendThreshold = 3;

        @Min(1)
        private int transientFailureCooldownThreshold = 5;

        @DecimalMin("1.0")
        private double rateLimitBackoffMultiplier = 2.0;

        @NotNull private Duration maxCooldown = Duration.ofHours(24);

        // Account-wide health flips to ERROR at this many consecutive failures
        @Min(1)
        private int accountErrorThreshold = 5;
    }

    @Data
    public static class Sweep {
        @Min(1)
        private int staleReservationFactor = 2;

        @Min(1000)
        private long staleReservationIntervalMs = 60000;

        @Min(1000)
        private long cooldownIntervalMs = 60000;

        private String dailyResetCron = "0 0 0 * * *";

        private String dailyResetZone = "UTC";
    }

    @Data
    public static class Credentials {
        // Secret the AES key for stored credential backups is derived from
        @NotBlank private String secretKey;
    }
}
