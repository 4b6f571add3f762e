package com.postx.pool.entity;

/** Account-wide health, derived from failure counters and platform signals. */
public enum AccountHealthStatus {
    ACTIVE("Active and working"),
    COOLDOWN("Rate limited, waiting for cooldown to pass"),
    SUSPENDED("Suspended by platform or by repeated credential failures"),
    BANNED("Banned by platform"),
    ERROR("Failing repeatedly");

    private final String description;

    AccountHealthStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
