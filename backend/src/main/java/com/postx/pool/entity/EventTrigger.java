package com.postx.pool.entity;

public enum EventTrigger {
    SYSTEM,
    OPERATOR
}
