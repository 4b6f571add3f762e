package com.postx.pool.dto.response;

import com.postx.pool.entity.AccountHealthStatus;
import com.postx.pool.entity.Platform;
import com.postx.pool.entity.SocialAccount;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SocialAccountResponse {
    private Long id;
    private Long brandId;
    private Platform platform;
    private String displayName;
    private String platformUserId;
    private AccountHealthStatus healthStatus;
    private LocalDateTime cooldownUntil;
    private LocalDateTime lastUsedAt;
    private int postsUsedToday;
    private long successCount;
    private long failureCount;
    private int consecutiveFailures;
    private String lastError;
    private boolean active;
    private LocalDateTime createdAt;

    public static SocialAccountResponse fromEntity(SocialAccount account) {
        return SocialAccountResponse.builder()
                .id(account.getId())
                .brandId(account.getBrandId())
                .platform(account.getPlatform())
                .displayName(account.getDisplayName())
                .platformUserId(account.getPlatformUserId())
                .healthStatus(account.getHealthStatus())
                .cooldownUntil(account.getCooldownUntil())
                .lastUsedAt(account.getLastUsedAt())
                .postsUsedToday(account.getPostsUsedToday())
                .successCount(account.getSuccessCount())
                .failureCount(account.getFailureCount())
                .consecutiveFailures(account.getConsecutiveFailures())
                .lastError(account.getLastError())
                .active(account.isActive())
                .createdAt(account.getCreatedAt())
                .build();
    }
}
