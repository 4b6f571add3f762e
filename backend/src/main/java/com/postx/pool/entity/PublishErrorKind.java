package com.postx.pool.entity;

/** Failure classification reported by platform publishers. */
public enum PublishErrorKind {
    NETWORK_ERROR(true),
    AUTHENTICATION_ERROR(true),
    RATE_LIMITED(true),
    ACCOUNT_BANNED(true),
    ACCOUNT_SUSPENDED(true),
    CONTENT_REJECTED(false),
    PLATFORM_ERROR(true),
    VALIDATION_ERROR(false),
    TOKEN_EXPIRED(true),
    UNKNOWN(true);

    private final boolean retryableOnOtherAccount;

    PublishErrorKind(boolean retryableOnOtherAccount) {
        this.retryableOnOtherAccount = retryableOnOtherAccount;
    }

    /** False for content-level errors: another account would be rejected the same way. */
    public boolean isRetryableOnOtherAccount() {
        return retryableOnOtherAccount;
    }

    public boolean isCredentialFailure() {
        return this == AUTHENTICATION_ERROR || this == TOKEN_EXPIRED;
    }
}
