package com.postx.pool.entity;

import jakarta.persistence.*;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "account_pools",
        uniqueConstraints = {
            @UniqueConstraint(
                    name = "uk_account_pools_brand_platform_name",
                    columnNames = {"brand_id", "platform", "name"})
        },
        indexes = {
            @Index(name = "idx_account_pools_platform_active", columnList = "platform, active"),
            @Index(name = "idx_account_pools_brand", columnList = "brand_id")
        })
public class AccountPool {
    public static final int DEFAULT_COOLDOWN_MINUTES = 30;
    public static final int DEFAULT_MAX_POSTS_PER_DAY = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "brand_id", nullable = false)
    private Long brandId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "rotation_strategy", nullable = false, length = 20)
    @Builder.Default
    private RotationStrategy rotationStrategy = RotationStrategy.ROUND_ROBIN;

    @Column(name = "cooldown_minutes", nullable = false)
    @Builder.Default
    private int cooldownMinutes = DEFAULT_COOLDOWN_MINUTES;

    @Column(name = "max_posts_per_day", nullable = false)
    @Builder.Default
    private int maxPostsPerDay = DEFAULT_MAX_POSTS_PER_DAY;

    @Column(name = "auto_failover", nullable = false)
    @Builder.Default
    private boolean autoFailover = true;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @OneToMany(mappedBy = "accountPool", fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Builder.Default
    private List<PoolMembership> memberships = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Duration getCooldownDuration() {
        return Duration.ofMinutes(cooldownMinutes);
    }
}
