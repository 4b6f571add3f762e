package com.postx.pool.service.dispatch;

import com.postx.pool.entity.Platform;
import com.postx.pool.entity.PublishErrorKind;
import java.time.LocalDateTime;

/** One publish attempt inside a dispatch. Logged and audited, never persisted as state. */
public record DispatchOutcome(
        String dispatchId,
        Long poolId,
        Long membershipId,
        Long accountId,
        Platform platform,
        int attemptNumber,
        boolean success,
        PublishErrorKind errorKind,
        String errorMessage,
        String postId,
        String postUrl,
        long latencyMs,
        LocalDateTime timestamp) {}
