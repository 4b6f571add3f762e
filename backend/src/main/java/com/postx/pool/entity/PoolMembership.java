package com.postx.pool.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * Per-pool rotation state of one account.
 *
 * <p>A stored COOLDOWN status is only authoritative while {@code cooldownUntil} is in the future;
 * once it has passed the membership reads as ACTIVE through {@link #effectiveStatus} even if no
 * sweep has rewritten the row yet.
 *
 * <p>{@code inFlight} marks a reservation held by one dispatch. The reservation already counts
 * towards {@code postsToday}; it is finalized or rolled back when the outcome is recorded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "pool_memberships",
        uniqueConstraints = {
            @UniqueConstraint(
                    name = "uk_pool_memberships_pool_account",
                    columnNames = {"account_pool_id", "social_account_id"})
        },
        indexes = {
            @Index(name = "idx_pool_memberships_status_cooldown", columnList = "status, cooldown_until"),
            @Index(name = "idx_pool_memberships_priority_weight", columnList = "priority, weight"),
            @Index(name = "idx_pool_memberships_in_flight", columnList = "in_flight, reserved_at")
        })
public class PoolMembership {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_pool_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AccountPool accountPool;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "social_account_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private SocialAccount socialAccount;

    @Column(nullable = false)
    @Builder.Default
    private int priority = 0;

    @Column(nullable = false)
    @Builder.Default
    private int weight = 100;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private MembershipStatus status = MembershipStatus.ACTIVE;

    @Column(name = "cooldown_until")
    private LocalDateTime cooldownUntil;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "posts_today", nullable = false)
    @Builder.Default
    private int postsToday = 0;

    @Column(name = "total_posts", nullable = false)
    @Builder.Default
    private long totalPosts = 0;

    @Column(name = "success_count", nullable = false)
    @Builder.Default
    private long successCount = 0;

    @Column(name = "failure_count", nullable = false)
    @Builder.Default
    private long failureCount = 0;

    @Column(name = "consecutive_failures", nullable = false)
    @Builder.Default
    private int consecutiveFailures = 0;

    @Column(name = "rate_limit_streak", nullable = false)
    @Builder.Default
    private int rateLimitStreak = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_failure_at")
    private LocalDateTime lastFailureAt;

    @Column(name = "in_flight", nullable = false)
    @Builder.Default
    private boolean inFlight = false;

    @Column(name = "reserved_at")
    private LocalDateTime reservedAt;

    @Column(name = "reservation_token", length = 36)
    private String reservationToken;

    @Version
    @Builder.Default
    private Long version = 0L;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Long getAccountId() {
        return socialAccount != null ? socialAccount.getId() : null;
    }

    public boolean holdsReservation(String token) {
        return inFlight && token != null && token.equals(reservationToken);
    }

    public void releaseReservation() {
        inFlight = false;
        reservedAt = null;
        reservationToken = null;
    }

    public boolean isCoolingDown(LocalDateTime now) {
        return cooldownUntil != null && cooldownUntil.isAfter(now);
    }

    /** Stored status with lazy cooldown expiry applied. */
    public MembershipStatus effectiveStatus(LocalDateTime now) {
        if (status == MembershipStatus.COOLDOWN && !isCoolingDown(now)) {
            return MembershipStatus.ACTIVE;
        }
        return status;
    }

    /**
     * Eligible candidate: not banned, not suspended, not cooling down and under the pool's daily
     * cap. Reservations are a separate concern and are not considered here.
     */
    public boolean isEligible(LocalDateTime now, int maxPostsPerDay) {
        MembershipStatus current = effectiveStatus(now);
        if (current.isTerminal() || current == MembershipStatus.COOLDOWN) {
            return false;
        }
        if (isCoolingDown(now)) {
            return false;
        }
        if (socialAccount != null && !socialAccount.isActive()) {
            return false;
        }
        return postsToday < maxPostsPerDay;
    }

    public double getSuccessRate() {
        long total = successCount + failureCount;
        if (total == 0) {
            return 100.0;
        }
        return Math.round((successCount * 10000.0) / total) / 100.0;
    }
}
