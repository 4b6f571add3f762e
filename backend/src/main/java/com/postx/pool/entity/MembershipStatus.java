package com.postx.pool.entity;

/** Status of one account inside one pool. Independent of the same account's state in other pools. */
public enum MembershipStatus {
    ACTIVE,
    COOLDOWN,
    SUSPENDED,
    BANNED,
    ERROR;

    /** Suspended and banned members need an operator reset before they can post again. */
    public boolean isTerminal() {
        return this == SUSPENDED || this == BANNED;
    }
}
