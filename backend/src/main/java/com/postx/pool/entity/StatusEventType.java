package com.postx.pool.entity;

public enum StatusEventType {
    COOLDOWN_STARTED,
    COOLDOWN_ENDED,
    ACCOUNT_ERROR,
    ACCOUNT_SUSPENDED,
    ACCOUNT_BANNED,
    ACCOUNT_RECOVERED,
    RESERVATION_EXPIRED
}
