package com.postx.pool.dto.response;

import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.Platform;
import com.postx.pool.entity.RotationStrategy;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Pool settings without members; built without touching the lazy membership collection. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountPoolResponse {
    private Long id;
    private Long brandId;
    private Platform platform;
    private String name;
    private String description;
    private RotationStrategy rotationStrategy;
    private int cooldownMinutes;
    private int maxPostsPerDay;
    private boolean autoFailover;
    private boolean active;
    private long memberCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static AccountPoolResponse fromEntity(AccountPool pool, long memberCount) {
        return AccountPoolResponse.builder()
                .id(pool.getId())
                .brandId(pool.getBrandId())
                .platform(pool.getPlatform())
                .name(pool.getName())
                .description(pool.getDescription())
                .rotationStrategy(pool.getRotationStrategy())
                .cooldownMinutes(pool.getCooldownMinutes())
                .maxPostsPerDay(pool.getMaxPostsPerDay())
                .autoFailover(pool.isAutoFailover())
                .active(pool.isActive())
                .memberCount(memberCount)
                .createdAt(pool.getCreatedAt())
                .updatedAt(pool.getUpdatedAt())
                .build();
    }
}
