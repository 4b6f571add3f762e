package com.postx.pool.service.health;

import com.postx.pool.entity.PublishErrorKind;
import lombok.Builder;
import lombok.Data;

/** Result of one publish attempt as fed into the health manager. */
@Builder
@Data
public class PublishOutcome {
    private final boolean success;
    private final PublishErrorKind errorKind;
    private final String errorMessage;
    private final String postId;
    private final String url;
    private final long latencyMs;

    public static PublishOutcome success(String postId, String url, long latencyMs) {
        return PublishOutcome.builder()
                .success(true)
                .postId(postId)
                .url(url)
                .latencyMs(latencyMs)
                .build();
    }

    public static PublishOutcome failure(PublishErrorKind errorKind, String errorMessage, long latencyMs) {
        return PublishOutcome.builder()
                .success(false)
                .errorKind(errorKind != null ? errorKind : PublishErrorKind.UNKNOWN)
                .errorMessage(errorMessage)
                .latencyMs(latencyMs)
                .build();
    }

    public static PublishOutcome failure(PublishErrorKind errorKind, String errorMessage) {
        return failure(errorKind, errorMessage, 0L);
    }

    /** Value stored in {@code lastError}: the kind, with the publisher's message when present. */
    public String describeError() {
        if (success) {
            return null;
        }
        if (errorMessage == null || errorMessage.isBlank()) {
            return errorKind.name();
        }
        return errorKind.name() + ": " + errorMessage;
    }
}
