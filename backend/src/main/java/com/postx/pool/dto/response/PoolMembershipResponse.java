package com.postx.pool.dto.response;

import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PoolMembership;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolMembershipResponse {
    private Long id;
    private Long accountPoolId;
    private Long socialAccountId;
    private String accountDisplayName;
    private Platform platform;
    private int priority;
    private int weight;
    private MembershipStatus status;
    private MembershipStatus effectiveStatus;
    private LocalDateTime cooldownUntil;
    private LocalDateTime lastUsedAt;
    private int postsToday;
    private long totalPosts;
    private long successCount;
    private long failureCount;
    private int consecutiveFailures;
    private String lastError;
    private boolean inFlight;
    private double successRate;

    /** Expects the social account to be fetched; the pool is only read by id. */
    public static PoolMembershipResponse fromEntityWithFetchedAccount(
            PoolMembership membership, LocalDateTime now) {
        return PoolMembershipResponse.builder()
                .id(membership.getId())
                .accountPoolId(membership.getAccountPool().getId())
                .socialAccountId(membership.getAccountId())
                .accountDisplayName(membership.getSocialAccount().getDisplayName())
                .platform(membership.getSocialAccount().getPlatform())
                .priority(membership.getPriority())
                .weight(membership.getWeight())
                .status(membership.getStatus())
                .effectiveStatus(membership.effectiveStatus(now))
                .cooldownUntil(membership.getCooldownUntil())
                .lastUsedAt(membership.getLastUsedAt())
                .postsToday(membership.getPostsToday())
                .totalPosts(membership.getTotalPosts())
                .successCount(membership.getSuccessCount())
                .failureCount(membership.getFailureCount())
                .consecutiveFailures(membership.getConsecutiveFailures())
                .lastError(membership.getLastError())
                .inFlight(membership.isInFlight())
                .successRate(membership.getSuccessRate())
                .build();
    }
}
