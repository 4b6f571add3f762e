package com.postx.pool.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * One linked credential/session on a platform. Lifetime counters here aggregate every pool the
 * account belongs to; per-pool rotation state lives on {@link PoolMembership}.
 *
 * <p>The health status column is never written by callers. It is recomputed from the ban and
 * suspension signals, the cooldown timer and the consecutive failure count whenever one of them
 * changes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "social_accounts",
        indexes = {
            @Index(name = "idx_social_accounts_brand_platform", columnList = "brand_id, platform"),
            @Index(name = "idx_social_accounts_health", columnList = "health_status"),
            @Index(name = "idx_social_accounts_active", columnList = "active")
        })
public class SocialAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "brand_id", nullable = false)
    private Long brandId;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Column(name = "platform_user_id")
    private String platformUserId;

    // Live credentials used by publishers; never exposed through the API
    @ToString.Exclude
    @Column(name = "access_token", columnDefinition = "TEXT")
    private String accessToken;

    @ToString.Exclude
    @Column(name = "refresh_token", columnDefinition = "TEXT")
    private String refreshToken;

    @Column(name = "token_expires_at")
    private LocalDateTime tokenExpiresAt;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(name = "health_status", nullable = false, length = 20)
    @Builder.Default
    private AccountHealthStatus healthStatus = AccountHealthStatus.ACTIVE;

    @Column(name = "banned_signal", nullable = false)
    @Builder.Default
    private boolean bannedSignal = false;

    @Column(name = "suspended_signal", nullable = false)
    @Builder.Default
    private boolean suspendedSignal = false;

    @Column(name = "cooldown_until")
    private LocalDateTime cooldownUntil;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "posts_used_today", nullable = false)
    @Builder.Default
    private int postsUsedToday = 0;

    @Column(name = "success_count", nullable = false)
    @Builder.Default
    private long successCount = 0;

    @Column(name = "failure_count", nullable = false)
    @Builder.Default
    private long failureCount = 0;

    @Column(name = "consecutive_failures", nullable = false)
    @Builder.Default
    private int consecutiveFailures = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "deactivated_at")
    private LocalDateTime deactivatedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void recordSuccess(LocalDateTime now, int errorThreshold) {
        successCount++;
        postsUsedToday++;
        consecutiveFailures = 0;
        lastUsedAt = now;
        lastError = null;
        refreshHealthStatus(now, errorThreshold);
    }

    public void recordFailure(String error, LocalDateTime now, int errorThreshold) {
        failureCount++;
        consecutiveFailures++;
        lastUsedAt = now;
        lastError = error;
        refreshHealthStatus(now, errorThreshold);
    }

    public void signalBanned() {
        bannedSignal = true;
    }

    public void signalSuspended() {
        suspendedSignal = true;
    }

    /** Extends the account-wide cooldown; never shortens one that is already running longer. */
    public void coolDownUntil(LocalDateTime until) {
        if (cooldownUntil == null || cooldownUntil.isBefore(until)) {
            cooldownUntil = until;
        }
    }

    /** Operator recovery: drops ban/suspension signals and the failure streak. */
    public void clearSignals(LocalDateTime now, int errorThreshold) {
        bannedSignal = false;
        suspendedSignal = false;
        consecutiveFailures = 0;
        cooldownUntil = null;
        lastError = null;
        refreshHealthStatus(now, errorThreshold);
    }

    public boolean hasCredentials() {
        return accessToken != null || refreshToken != null;
    }

    public void deactivate(LocalDateTime now) {
        active = false;
        deactivatedAt = now;
    }

    public void resetDailyUsage() {
        postsUsedToday = 0;
    }

    public AccountHealthStatus refreshHealthStatus(LocalDateTime now, int errorThreshold) {
        healthStatus = deriveHealthStatus(now, errorThreshold);
        return healthStatus;
    }

    public AccountHealthStatus deriveHealthStatus(LocalDateTime now, int errorThreshold) {
        if (bannedSignal) {
            return AccountHealthStatus.BANNED;
        }
        if (suspendedSignal) {
            return AccountHealthStatus.SUSPENDED;
        }
        if (cooldownUntil != null && cooldownUntil.isAfter(now)) {
            return AccountHealthStatus.COOLDOWN;
        }
        if (consecutiveFailures >= errorThreshold) {
            return AccountHealthStatus.ERROR;
        }
        return AccountHealthStatus.ACTIVE;
    }
}
