package com.postx.pool.service.dispatch;

import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PublishErrorKind;
import lombok.Builder;
import lombok.Data;

/**
 * What the caller of a dispatch sees when an attempt settled it. Running out of attempts is not a
 * result but a {@link com.postx.pool.exception.PoolExhaustedException}; the per-attempt detail
 * stays in the outcome log.
 */
@Builder
@Data
public class DispatchResult {
    private final String dispatchId;
    private final DispatchStatus status;
    private final Long poolId;
    private final Platform platform;
    private final Long membershipId;
    private final Long accountId;
    private final String postId;
    private final String postUrl;
    private final PublishErrorKind errorKind;
    private final String errorMessage;
    private final int attempts;

    public boolean isSuccess() {
        return status == DispatchStatus.PUBLISHED;
    }

    public static DispatchResult published(
            String dispatchId, DispatchOutcome outcome, Platform platform) {
        return DispatchResult.builder()
                .dispatchId(dispatchId)
                .status(DispatchStatus.PUBLISHED)
                .poolId(outcome.poolId())
                .platform(platform)
                .membershipId(outcome.membershipId())
                .accountId(outcome.accountId())
                .postId(outcome.postId())
                .postUrl(outcome.postUrl())
                .attempts(outcome.attemptNumber())
                .build();
    }

    public static DispatchResult contentRejected(
            String dispatchId, DispatchOutcome outcome, Platform platform) {
        return DispatchResult.builder()
                .dispatchId(dispatchId)
                .status(DispatchStatus.CONTENT_REJECTED)
                .poolId(outcome.poolId())
                .platform(platform)
                .membershipId(outcome.membershipId())
                .accountId(outcome.accountId())
                .errorKind(outcome.errorKind())
                .errorMessage(outcome.errorMessage())
                .attempts(outcome.attemptNumber())
                .build();
    }
}
